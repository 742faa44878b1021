package com.lbg.markets.surveillance.pipeline.registration;

import com.lbg.markets.surveillance.pipeline.domain.ObjectLocation;
import com.lbg.markets.surveillance.pipeline.registration.MetadataApiClient.RegistrationRequest;
import com.lbg.markets.surveillance.pipeline.registration.MetadataApiClient.RegistrationResponse;
import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.WebApplicationException;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class RestMetadataRegistrarTest {

    private static final UUID FILE_ID = UUID.fromString("550e8400-e29b-41d4-a716-446655440000");
    private static final ObjectLocation DESTINATION =
            new ObjectLocation("dest-bucket", "2025/01/15/14/30/45/" + FILE_ID);

    @Test
    void shouldSendDerivedIdAndMetadata() throws RegistrationException {
        AtomicReference<RegistrationRequest> sent = new AtomicReference<>();
        RestMetadataRegistrar registrar = new RestMetadataRegistrar(request -> {
            sent.set(request);
            return new RegistrationResponse(request.fileId());
        });

        UUID id = registrar.register(Map.of("fileId", "100", "type", "project1"), DESTINATION);

        assertEquals(FILE_ID, id);
        assertEquals(FILE_ID, sent.get().fileId());
        assertEquals("dest-bucket", sent.get().bucket());
        assertEquals(DESTINATION.key(), sent.get().key());
        assertEquals("project1", sent.get().metadata().get("type"));
    }

    @Test
    void shouldRejectResponseWithDifferentId() {
        RestMetadataRegistrar registrar = new RestMetadataRegistrar(request -> new RegistrationResponse(UUID.randomUUID()));

        RegistrationException e = assertThrows(RegistrationException.class,
                () -> registrar.register(Map.of(), DESTINATION));
        assertTrue(e.getMessage().contains(FILE_ID.toString()));
    }

    @Test
    void shouldWrapHttpErrors() {
        RestMetadataRegistrar registrar = new RestMetadataRegistrar(request -> {
            throw new WebApplicationException(503);
        });

        RegistrationException e = assertThrows(RegistrationException.class,
                () -> registrar.register(Map.of(), DESTINATION));
        assertTrue(e.getMessage().contains("503"));
    }

    @Test
    void shouldWrapConnectionErrors() {
        RestMetadataRegistrar registrar = new RestMetadataRegistrar(request -> {
            throw new ProcessingException("Connection refused");
        });

        RegistrationException e = assertThrows(RegistrationException.class,
                () -> registrar.register(Map.of(), DESTINATION));
        assertInstanceOf(ProcessingException.class, e.getCause());
    }

    @Test
    void shouldRejectDestinationWithoutKeyId() {
        RestMetadataRegistrar registrar = new RestMetadataRegistrar(request -> new RegistrationResponse(request.fileId()));

        assertThrows(RegistrationException.class,
                () -> registrar.register(Map.of(), ObjectLocation.pending("dest-bucket")));
    }
}
