package tech.yump.multipart.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.yump.multipart.secrets.multipart.PartCodec;
import tech.yump.multipart.secrets.multipart.Partitioner;
import tech.yump.multipart.secrets.multipart.SlotAllocator;

@Configuration
@Slf4j
public class PartitioningConfiguration {

    @Bean
    public Partitioner partitioner(PartCodec partCodec, MultipartProperties properties) {
        int maxPartBytes = properties.partitioning().maxPartBytes();
        log.info("Secret parts are limited to {} bytes", maxPartBytes);
        return new Partitioner(partCodec, maxPartBytes);
    }

    @Bean
    public SlotAllocator slotAllocator(MultipartProperties properties) {
        return new SlotAllocator(properties.partitioning().maxOverflowParts());
    }
}
