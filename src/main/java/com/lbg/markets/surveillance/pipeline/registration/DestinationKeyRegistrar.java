package com.lbg.markets.surveillance.pipeline.registration;

import com.lbg.markets.surveillance.pipeline.domain.ObjectLocation;
import com.lbg.markets.surveillance.pipeline.util.DestinationKeys;
import com.lbg.markets.surveillance.pipeline.util.SimulatedLatency;
import io.quarkus.arc.profile.IfBuildProfile;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;

/**
 * Registrar for development and tests.
 * Does not call any API; answers with the identifier embedded in the destination key,
 * so the object store and the registry share one id per file.
 */
@ApplicationScoped
@IfBuildProfile(anyOf = {"dev", "test"})
public class DestinationKeyRegistrar implements MetadataRegistrar {

    private static final Logger LOG = Logger.getLogger(DestinationKeyRegistrar.class);

    private final SimulatedLatency latency;

    @Inject
    public DestinationKeyRegistrar(
            @ConfigProperty(name = "pipeline.simulation.register-latency-min", defaultValue = "PT0S") Duration min,
            @ConfigProperty(name = "pipeline.simulation.register-latency-max", defaultValue = "PT0S") Duration max
    ) {
        this(new SimulatedLatency(min, max));
    }

    public DestinationKeyRegistrar(SimulatedLatency latency) {
        this.latency = latency;
    }

    @Override
    public UUID register(Map<String, String> metadata, ObjectLocation destination) throws RegistrationException {
        UUID registrationId;
        try {
            registrationId = DestinationKeys.uniqueId(destination.key());
        } catch (IllegalArgumentException e) {
            throw new RegistrationException("Cannot derive registration id for " + destination, e);
        }

        try {
            latency.pause();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RegistrationException("Interrupted while registering " + destination, e);
        }

        LOG.debugf("Simulated registration of %s as %s (metadata: %s)", destination, registrationId, metadata);
        return registrationId;
    }
}
