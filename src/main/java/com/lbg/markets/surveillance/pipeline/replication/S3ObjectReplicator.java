package com.lbg.markets.surveillance.pipeline.replication;

import com.lbg.markets.surveillance.pipeline.domain.ObjectLocation;
import io.quarkus.arc.profile.IfBuildProfile;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CopyObjectRequest;
import software.amazon.awssdk.services.s3.model.CopyObjectResponse;

/**
 * Server-side S3 to S3 copy.
 * Copying the same source to the same key again overwrites it with identical content.
 */
@ApplicationScoped
@IfBuildProfile("prod")
public class S3ObjectReplicator implements ObjectReplicator {

    private static final Logger LOG = Logger.getLogger(S3ObjectReplicator.class);

    private final S3Client s3;

    @Inject
    public S3ObjectReplicator(S3Client s3) {
        this.s3 = s3;
    }

    @Override
    public String replicate(ObjectLocation source, ObjectLocation destination) throws TransferException {
        if (!source.hasKey()) {
            throw new TransferException("Source has no key: " + source);
        }
        if (!destination.hasKey()) {
            throw new TransferException("No destination key given for " + source);
        }

        CopyObjectRequest request = CopyObjectRequest.builder()
                .sourceBucket(source.bucket())
                .sourceKey(source.key())
                .destinationBucket(destination.bucket())
                .destinationKey(destination.key())
                .build();

        try {
            CopyObjectResponse response = s3.copyObject(request);
            LOG.debugf("Copied s3://%s -> s3://%s (etag %s)",
                    source, destination, response.copyObjectResult().eTag());
            return destination.key();
        } catch (SdkException e) {
            throw new TransferException("S3 copy failed for " + source + ": " + e.getMessage(), e);
        }
    }
}
