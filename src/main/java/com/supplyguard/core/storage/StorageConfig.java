package com.supplyguard.core.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the in-memory repository unless another {@link SupplyChainRepository} is provided.
 */
@Configuration
public class StorageConfig {

    @Bean
    @ConditionalOnMissingBean(SupplyChainRepository.class)
    public SupplyChainRepository supplyChainRepository(
            ObjectMapper objectMapper,
            @Value("${supplyguard.storage.seed-location:seed/supply-chain.json}") String seedLocation) {
        return InMemorySupplyChainRepository.fromClasspath(objectMapper, seedLocation);
    }
}
