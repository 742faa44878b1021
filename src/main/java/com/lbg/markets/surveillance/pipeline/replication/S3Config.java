package com.lbg.markets.surveillance.pipeline.replication;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.Optional;

/**
 * Settings for the S3 client used by the production replicator.
 * All keys are namespaced under {@code pipeline.s3.*}.
 */
@ConfigMapping(prefix = "pipeline.s3")
public interface S3Config {

    @WithDefault("eu-west-2")
    String region();

    /**
     * Endpoint override, e.g. a MinIO URL. The AWS default endpoint is used when absent.
     */
    Optional<String> endpoint();

    /**
     * Static credentials; the default AWS credential chain is used when absent.
     */
    Optional<String> accessKey();

    Optional<String> secretKey();

    /**
     * Whether to use path-style access (required for most MinIO setups).
     */
    @WithDefault("false")
    boolean pathStyleAccess();
}
