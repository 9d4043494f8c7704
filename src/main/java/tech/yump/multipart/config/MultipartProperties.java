package tech.yump.multipart.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Configuration properties for the multipart secrets application under the 'multipart' prefix.
 */
@ConfigurationProperties(prefix = "multipart")
@Validated
public record MultipartProperties(

        @Valid
        @NotNull(message = "Store configuration (multipart.store) is required.")
        StoreProperties store,

        @Valid
        @NotNull(message = "Partitioning configuration (multipart.partitioning) is required.")
        PartitioningProperties partitioning,

        @Valid
        TagProperties tags
) {

    public MultipartProperties {
        if (tags == null) {
            tags = new TagProperties(null, null);
        }
    }

    public enum StoreBackend {
        AWS, FILESYSTEM
    }

    // --- StoreProperties ---
    @Validated
    public record StoreProperties(
            @NotNull(message = "Store backend (multipart.store.backend) must be 'aws' or 'filesystem'.")
            StoreBackend backend,

            @Valid
            AwsProperties aws,

            @Valid
            FileSystemProperties filesystem
    ) {
        @AssertTrue(message = "Filesystem store path (multipart.store.filesystem.path) must be provided when the filesystem backend is selected.")
        public boolean isFilesystemConfigValid() {
            return backend != StoreBackend.FILESYSTEM
                    || (filesystem != null && StringUtils.hasText(filesystem.path()));
        }

        @AssertTrue(message = "AWS region (multipart.store.aws.region) must be provided when the aws backend is selected.")
        public boolean isAwsConfigValid() {
            return backend != StoreBackend.AWS
                    || (aws != null && StringUtils.hasText(aws.region()));
        }

        // --- AwsProperties ---
        @Validated
        public record AwsProperties(
                String region,
                String endpoint, // Optional, e.g. a LocalStack URL
                String accessKey, // Optional, falls back to the default credentials chain
                String secretKey
        ) {
            @AssertTrue(message = "AWS access key and secret key (multipart.store.aws.access-key / secret-key) must be set together.")
            public boolean isStaticCredentialsValid() {
                return StringUtils.hasText(accessKey) == StringUtils.hasText(secretKey);
            }

            @Override
            public String toString() {
                // Avoid logging the secret key in toString()
                return "AwsProperties[" +
                        "region='" + region + '\'' +
                        ", endpoint='" + endpoint + '\'' +
                        ", accessKey='" + accessKey + '\'' +
                        ", secretKey=******" +
                        ']';
            }
        }

        // --- FileSystemProperties ---
        @Validated
        public record FileSystemProperties(
                String path
        ) {}
    }

    @Validated
    public record PartitioningProperties(
            @Min(value = 3, message = "Max part size (multipart.partitioning.max-part-bytes) must be at least 3 bytes.")
            @Max(value = 65536, message = "Max part size (multipart.partitioning.max-part-bytes) cannot exceed the 64 KiB secret size limit.")
            int maxPartBytes,

            @Min(value = 0, message = "Max overflow parts (multipart.partitioning.max-overflow-parts) cannot be negative.")
            int maxOverflowParts
    ) {}

    /**
     * Tags attached to parts when they are created. The environment of the invocation is added under
     * {@code environmentKey}.
     */
    @Validated
    public record TagProperties(
            @NotBlank(message = "Environment tag key (multipart.tags.environment-key) cannot be blank.")
            String environmentKey,

            Map<String, String> defaults
    ) {
        public static final String DEFAULT_ENVIRONMENT_KEY = "temp:env";

        public TagProperties {
            if (environmentKey == null) {
                environmentKey = DEFAULT_ENVIRONMENT_KEY;
            }
            defaults = defaults == null ? Collections.emptyMap() : Collections.unmodifiableMap(new TreeMap<>(defaults));
        }
    }
}
