package com.lbg.markets.surveillance.pipeline.replication;

import com.lbg.markets.surveillance.pipeline.domain.ObjectLocation;
import com.lbg.markets.surveillance.pipeline.util.SimulatedLatency;
import io.quarkus.arc.profile.IfBuildProfile;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;

/**
 * Replicator for development and tests.
 * Pretends to copy the object after a configurable delay and reports the requested key.
 */
@ApplicationScoped
@IfBuildProfile(anyOf = {"dev", "test"})
public class SimulatedObjectReplicator implements ObjectReplicator {

    private static final Logger LOG = Logger.getLogger(SimulatedObjectReplicator.class);

    private final SimulatedLatency latency;

    @Inject
    public SimulatedObjectReplicator(
            @ConfigProperty(name = "pipeline.simulation.replicate-latency-min", defaultValue = "PT0S") Duration min,
            @ConfigProperty(name = "pipeline.simulation.replicate-latency-max", defaultValue = "PT0S") Duration max
    ) {
        this(new SimulatedLatency(min, max));
    }

    public SimulatedObjectReplicator(SimulatedLatency latency) {
        this.latency = latency;
    }

    @Override
    public String replicate(ObjectLocation source, ObjectLocation destination) throws TransferException {
        if (!destination.hasKey()) {
            throw new TransferException("No destination key given for " + source);
        }
        try {
            latency.pause();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransferException("Interrupted while copying " + source, e);
        }
        LOG.debugf("Simulated copy %s -> %s", source, destination);
        return destination.key();
    }
}
