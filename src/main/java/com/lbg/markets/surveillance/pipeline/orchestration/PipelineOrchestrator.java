package com.lbg.markets.surveillance.pipeline.orchestration;

import com.lbg.markets.surveillance.pipeline.domain.FileTask;
import com.lbg.markets.surveillance.pipeline.domain.VerificationReport;
import com.lbg.markets.surveillance.pipeline.registration.MetadataRegistrar;
import com.lbg.markets.surveillance.pipeline.replication.ObjectReplicator;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Runs file batches through the pipeline with the configured collaborators and pool sizes.
 */
@ApplicationScoped
public class PipelineOrchestrator {

    private static final Logger LOG = Logger.getLogger(PipelineOrchestrator.class);

    @Inject
    ObjectReplicator replicator;

    @Inject
    MetadataRegistrar registrar;

    @ConfigProperty(name = "pipeline.transfer.workers", defaultValue = "3")
    int transferWorkers;

    @ConfigProperty(name = "pipeline.metadata.workers", defaultValue = "2")
    int metadataWorkers;

    @ConfigProperty(name = "pipeline.queue.capacity", defaultValue = "0")
    int queueCapacity;

    @ConfigProperty(name = "pipeline.await-timeout", defaultValue = "PT30M")
    Duration awaitTimeout;

    @ConfigProperty(name = "pipeline.dispatch.delay", defaultValue = "PT0S")
    Duration dispatchDelay;

    private Pipeline pipeline;

    public PipelineOrchestrator() {
    }

    /**
     * Orchestrator over an already built pipeline, for use outside the container.
     */
    public PipelineOrchestrator(Pipeline pipeline) {
        this.pipeline = pipeline;
    }

    @PostConstruct
    void init() {
        PipelineSettings settings = new PipelineSettings(transferWorkers, metadataWorkers, queueCapacity,
                awaitTimeout, dispatchDelay, Clock.systemDefaultZone());
        pipeline = new Pipeline(replicator, registrar, settings);
        LOG.infof("Pipeline orchestrator ready: %d transfer workers, %d metadata workers, queue capacity %s",
                transferWorkers, metadataWorkers, queueCapacity > 0 ? queueCapacity : "unbounded");
    }

    /**
     * Execute a run over the given batch and return the verification report.
     */
    public VerificationReport executeRun(List<FileTask> tasks) {
        LOG.infof("Starting run for %d files", tasks.size());
        VerificationReport report = pipeline.run(tasks);

        if (report.isClean()) {
            LOG.infof("Run complete: all %d files replicated and registered", report.succeeded());
        } else {
            LOG.warnf("Run complete with problems: %d failed, %d missing", report.failed(), report.missing());
        }
        return report;
    }

    /**
     * Prepare a run that the caller starts, and may cancel, itself.
     */
    public PipelineRun prepareRun(List<FileTask> tasks) {
        return pipeline.newRun(tasks);
    }

    public PipelineSettings settings() {
        return pipeline.settings();
    }
}
