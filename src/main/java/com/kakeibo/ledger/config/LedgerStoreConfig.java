package com.kakeibo.ledger.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kakeibo.ledger.id.IdGenerator;
import com.kakeibo.ledger.store.InMemoryLedgerRepository;
import com.kakeibo.ledger.store.JsonFileLedgerRepository;
import com.kakeibo.ledger.store.LedgerNormalizer;
import com.kakeibo.ledger.store.LedgerRepository;
import com.kakeibo.ledger.store.LedgerStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;
import java.time.Clock;

@Configuration
public class LedgerStoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    @ConditionalOnProperty(name = "ledger.storage", havingValue = "file", matchIfMissing = true)
    public LedgerRepository jsonFileLedgerRepository(
            @Value("${ledger.data-dir}") String dataDir, ObjectMapper objectMapper) {
        return new JsonFileLedgerRepository(Paths.get(dataDir), objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "ledger.storage", havingValue = "memory")
    public LedgerRepository inMemoryLedgerRepository(ObjectMapper objectMapper) {
        return new InMemoryLedgerRepository(objectMapper);
    }

    @Bean
    public LedgerStore ledgerStore(LedgerRepository ledgerRepository, LedgerNormalizer normalizer,
                                   IdGenerator idGenerator) {
        return LedgerStore.open(ledgerRepository, normalizer, idGenerator);
    }
}
