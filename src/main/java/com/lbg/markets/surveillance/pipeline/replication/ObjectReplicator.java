package com.lbg.markets.surveillance.pipeline.replication;

import com.lbg.markets.surveillance.pipeline.domain.ObjectLocation;

/**
 * Copies an object from one store location to another.
 * Implementations must be safe to call again for the same source.
 */
public interface ObjectReplicator {

    /**
     * Copy {@code source} to {@code destination}.
     *
     * @return the key the object was written under
     */
    String replicate(ObjectLocation source, ObjectLocation destination) throws TransferException;
}
