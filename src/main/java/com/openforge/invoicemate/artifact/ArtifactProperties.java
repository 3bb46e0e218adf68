package com.openforge.invoicemate.artifact;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * invoicemate:
 *   artifact:
 *     bucket: invoicemate-artifacts
 *     prefix: sessiondumps
 *     region: us-east-1
 *     endpoint:                 # optional, for S3-compatible stores
 *     access-key: ${ARTIFACT_ACCESS_KEY:}
 *     secret-key: ${ARTIFACT_SECRET_KEY:}
 *     default-expiry-minutes: 60
 *     max-expiry-minutes: 1440
 *
 * When no access key is configured the AWS default credentials chain is used.
 */
@ConfigurationProperties(prefix = "invoicemate.artifact")
public record ArtifactProperties(
        @DefaultValue("invoicemate-artifacts") String bucket,
        @DefaultValue("sessiondumps") String prefix,
        @DefaultValue("us-east-1") String region,
        String endpoint,
        String accessKey,
        String secretKey,
        @DefaultValue("false") boolean pathStyleAccess,
        @DefaultValue("60") int defaultExpiryMinutes,
        @DefaultValue("1440") int maxExpiryMinutes,
        @DefaultValue("20s") Duration apiCallTimeout
) {

    public boolean hasStaticCredentials() {
        return accessKey != null && !accessKey.isBlank() && secretKey != null && !secretKey.isBlank();
    }
}
