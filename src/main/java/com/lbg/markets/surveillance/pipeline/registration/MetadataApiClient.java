package com.lbg.markets.surveillance.pipeline.registration;

import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

import java.util.Map;
import java.util.UUID;

/**
 * REST client for the file metadata API.
 * Base URL is configured with {@code quarkus.rest-client.metadata-api.url}.
 */
@RegisterRestClient(configKey = "metadata-api")
@Path("/files")
public interface MetadataApiClient {

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    RegistrationResponse register(RegistrationRequest request);

    record RegistrationRequest(
            UUID fileId,
            String bucket,
            String key,
            Map<String, String> metadata
    ) {
    }

    record RegistrationResponse(
            UUID id
    ) {
    }
}
