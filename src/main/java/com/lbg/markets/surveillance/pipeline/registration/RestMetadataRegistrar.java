package com.lbg.markets.surveillance.pipeline.registration;

import com.lbg.markets.surveillance.pipeline.domain.ObjectLocation;
import com.lbg.markets.surveillance.pipeline.registration.MetadataApiClient.RegistrationRequest;
import com.lbg.markets.surveillance.pipeline.registration.MetadataApiClient.RegistrationResponse;
import com.lbg.markets.surveillance.pipeline.util.DestinationKeys;
import io.quarkus.arc.profile.IfBuildProfile;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.WebApplicationException;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jboss.logging.Logger;

import java.util.Map;
import java.util.UUID;

/**
 * Registers metadata with the remote file API.
 * The file id sent is the one embedded in the destination key and the API must echo it back.
 */
@ApplicationScoped
@IfBuildProfile("prod")
public class RestMetadataRegistrar implements MetadataRegistrar {

    private static final Logger LOG = Logger.getLogger(RestMetadataRegistrar.class);

    private final MetadataApiClient client;

    @Inject
    public RestMetadataRegistrar(@RestClient MetadataApiClient client) {
        this.client = client;
    }

    @Override
    public UUID register(Map<String, String> metadata, ObjectLocation destination) throws RegistrationException {
        UUID fileId;
        try {
            fileId = DestinationKeys.uniqueId(destination.key());
        } catch (IllegalArgumentException e) {
            throw new RegistrationException("Cannot derive file id for " + destination, e);
        }

        RegistrationResponse response;
        try {
            response = client.register(new RegistrationRequest(fileId, destination.bucket(), destination.key(), metadata));
        } catch (WebApplicationException e) {
            throw new RegistrationException(String.format("Metadata API rejected %s with HTTP %d",
                    fileId, e.getResponse().getStatus()), e);
        } catch (ProcessingException e) {
            throw new RegistrationException("Metadata API call failed for " + fileId + ": " + e.getMessage(), e);
        }

        if (response == null || response.id() == null) {
            throw new RegistrationException("Metadata API returned no id for " + fileId);
        }
        if (!fileId.equals(response.id())) {
            throw new RegistrationException(String.format(
                    "Metadata API assigned id %s but destination key carries %s", response.id(), fileId));
        }

        LOG.debugf("Registered %s with metadata API", fileId);
        return fileId;
    }
}
