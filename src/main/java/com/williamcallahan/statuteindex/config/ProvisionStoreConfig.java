package com.williamcallahan.statuteindex.config;

import com.williamcallahan.statuteindex.domain.legislation.ParsedStatute;
import com.williamcallahan.statuteindex.service.ingestion.SeedFileStore;
import com.williamcallahan.statuteindex.service.store.InMemoryProvisionStore;
import com.williamcallahan.statuteindex.service.store.ProvisionStore;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the provision store and loads it from the seed directory on startup.
 */
@Configuration
public class ProvisionStoreConfig {
    private static final Logger log = LoggerFactory.getLogger(ProvisionStoreConfig.class);

    @Bean
    public ProvisionStore provisionStore(SeedFileStore seedFileStore) {
        InMemoryProvisionStore store = new InMemoryProvisionStore();
        try {
            int provisions = 0;
            for (ParsedStatute statute : seedFileStore.readSeeds()) {
                store.save(statute);
                provisions += statute.provisions().size();
            }
            log.info("Loaded {} documents ({} provisions) from seeds", store.documentCount(), provisions);
        } catch (IOException seedFailure) {
            log.warn("Could not read seed directory, starting with an empty store: {}", seedFailure.getMessage());
        }
        return store;
    }
}
