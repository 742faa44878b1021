package com.lbg.markets.surveillance.pipeline.orchestration;

import com.lbg.markets.surveillance.pipeline.domain.FileTask;
import com.lbg.markets.surveillance.pipeline.domain.VerificationReport;
import com.lbg.markets.surveillance.pipeline.registration.MetadataRegistrar;
import com.lbg.markets.surveillance.pipeline.replication.ObjectReplicator;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Replicate, register and verify a batch of files.
 * Holds only collaborators and settings; every call builds a fresh {@link PipelineRun}.
 */
public class Pipeline {

    private final ObjectReplicator replicator;
    private final MetadataRegistrar registrar;
    private final PipelineSettings settings;

    public Pipeline(ObjectReplicator replicator, MetadataRegistrar registrar, PipelineSettings settings) {
        this.replicator = replicator;
        this.registrar = registrar;
        this.settings = settings;
    }

    /**
     * Prepare a run without starting it, e.g. to keep a handle for cancellation.
     */
    public PipelineRun newRun(List<FileTask> tasks) {
        requireUniqueReadyTasks(tasks);
        return new PipelineRun(tasks, settings,
                new TransferStage(replicator, settings.clock()),
                new MetadataStage(registrar));
    }

    public VerificationReport run(List<FileTask> tasks) {
        return newRun(tasks).execute();
    }

    public PipelineSettings settings() {
        return settings;
    }

    private static void requireUniqueReadyTasks(List<FileTask> tasks) {
        Set<String> ids = new HashSet<>();
        for (FileTask task : tasks) {
            if (!ids.add(task.id())) {
                throw new IllegalArgumentException("Duplicate task id: " + task.id());
            }
            if (task.status() != FileTask.TaskStatus.READY) {
                throw new IllegalArgumentException(String.format(
                        "Task %s must be READY to enter the pipeline but is %s", task.id(), task.status()));
            }
        }
    }
}
