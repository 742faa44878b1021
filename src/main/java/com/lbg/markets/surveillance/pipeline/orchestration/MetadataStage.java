package com.lbg.markets.surveillance.pipeline.orchestration;

import com.lbg.markets.surveillance.pipeline.domain.FileTask;
import com.lbg.markets.surveillance.pipeline.domain.PipelineStage;
import com.lbg.markets.surveillance.pipeline.registration.MetadataRegistrar;
import com.lbg.markets.surveillance.pipeline.registration.RegistrationException;
import com.lbg.markets.surveillance.pipeline.util.DestinationKeys;
import org.jboss.logging.Logger;

import java.util.UUID;

/**
 * Registers each transferred task's metadata.
 * The registration id must be the unique id embedded in the destination key.
 */
public class MetadataStage implements StageHandler {

    private static final Logger LOG = Logger.getLogger(MetadataStage.class);

    private final MetadataRegistrar registrar;

    public MetadataStage(MetadataRegistrar registrar) {
        this.registrar = registrar;
    }

    @Override
    public PipelineStage stage() {
        return PipelineStage.METADATA;
    }

    @Override
    public FileTask process(FileTask task) throws RegistrationException {
        UUID registrationId = registrar.register(task.metadata(), task.destination());

        UUID expected = DestinationKeys.uniqueId(task.destination().key());
        if (!expected.equals(registrationId)) {
            throw new RegistrationException(String.format(
                    "Registration id %s does not match destination key id %s", registrationId, expected));
        }

        LOG.infof("Registered %s as %s", task.name(), registrationId);
        return task.registered(registrationId);
    }
}
