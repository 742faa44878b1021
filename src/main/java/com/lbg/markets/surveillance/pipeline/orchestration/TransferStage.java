package com.lbg.markets.surveillance.pipeline.orchestration;

import com.lbg.markets.surveillance.pipeline.domain.FileTask;
import com.lbg.markets.surveillance.pipeline.domain.PipelineStage;
import com.lbg.markets.surveillance.pipeline.replication.ObjectReplicator;
import com.lbg.markets.surveillance.pipeline.replication.TransferException;
import com.lbg.markets.surveillance.pipeline.util.DestinationKeys;
import org.jboss.logging.Logger;

import java.time.Clock;

/**
 * Copies each task's object to a freshly keyed destination.
 */
public class TransferStage implements StageHandler {

    private static final Logger LOG = Logger.getLogger(TransferStage.class);

    private final ObjectReplicator replicator;
    private final Clock clock;

    public TransferStage(ObjectReplicator replicator, Clock clock) {
        this.replicator = replicator;
        this.clock = clock;
    }

    @Override
    public PipelineStage stage() {
        return PipelineStage.TRANSFER;
    }

    @Override
    public FileTask process(FileTask task) throws TransferException {
        String destinationKey = DestinationKeys.generate(clock);
        String writtenKey = replicator.replicate(task.source(), task.destination().withKey(destinationKey));
        if (!DestinationKeys.isValid(writtenKey)) {
            throw new TransferException("Replicator reported malformed destination key: " + writtenKey);
        }

        FileTask transferred = task.transferred(writtenKey);
        LOG.infof("Stored %s in bucket=[%s] key=[%s]",
                task.name(), transferred.destination().bucket(), transferred.destination().key());
        return transferred;
    }
}
