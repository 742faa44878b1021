package com.lbg.markets.surveillance.pipeline.registration;

import com.lbg.markets.surveillance.pipeline.domain.ObjectLocation;

import java.util.Map;
import java.util.UUID;

/**
 * Registers a replicated file's metadata with the remote API.
 */
public interface MetadataRegistrar {

    /**
     * Register {@code metadata} for the object stored at {@code destination}.
     * The returned identifier is the unique id embedded in the destination key.
     */
    UUID register(Map<String, String> metadata, ObjectLocation destination) throws RegistrationException;
}
