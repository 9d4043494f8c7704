package tech.yump.multipart.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClientBuilder;
import tech.yump.multipart.storage.FileSystemPartStore;
import tech.yump.multipart.storage.PartStore;
import tech.yump.multipart.storage.SecretsManagerPartStore;

import java.net.URI;

@Configuration
@Slf4j
public class StoreConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(name = "multipart.store.backend", havingValue = "aws", matchIfMissing = true)
    public SecretsManagerClient secretsManagerClient(MultipartProperties properties) {
        MultipartProperties.StoreProperties.AwsProperties aws = properties.store().aws();

        AwsCredentialsProvider credentialsProvider;
        if (StringUtils.hasText(aws.accessKey()) && StringUtils.hasText(aws.secretKey())) {
            credentialsProvider = StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(aws.accessKey(), aws.secretKey()));
        } else {
            credentialsProvider = DefaultCredentialsProvider.create();
        }

        SecretsManagerClientBuilder builder = SecretsManagerClient.builder()
                .region(Region.of(aws.region()))
                .credentialsProvider(credentialsProvider);

        // You cannot set the endpoint if AWS_USE_FIPS_ENDPOINT is set to `true`
        if (StringUtils.hasText(aws.endpoint())
                && !System.getenv().getOrDefault("AWS_USE_FIPS_ENDPOINT", "false").equals("true")) {
            builder.endpointOverride(URI.create(aws.endpoint()));
        }

        log.info("Configuring AWS Secrets Manager client for region {}", aws.region());
        return builder.build();
    }

    @Bean
    @ConditionalOnProperty(name = "multipart.store.backend", havingValue = "aws", matchIfMissing = true)
    public PartStore secretsManagerPartStore(SecretsManagerClient secretsManagerClient) {
        log.info("Configuring AWS Secrets Manager part store");
        return new SecretsManagerPartStore(secretsManagerClient);
    }

    @Bean
    @ConditionalOnProperty(name = "multipart.store.backend", havingValue = "filesystem")
    public PartStore fileSystemPartStore(ObjectMapper objectMapper, MultipartProperties properties) {
        log.info("Configuring filesystem part store at {}", properties.store().filesystem().path());
        return new FileSystemPartStore(objectMapper, properties.store().filesystem().path());
    }
}
