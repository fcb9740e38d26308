package com.example.indexingtelemetry.config;

import com.example.indexingtelemetry.kv.KvClient;
import com.example.indexingtelemetry.race.KvRaceDetector;
import com.example.indexingtelemetry.race.RaceDetector;
import com.example.indexingtelemetry.race.StoreRaceDetector;
import com.example.indexingtelemetry.store.RaceStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Locale;

@Configuration
public class RaceDetectorConfig {

    private static final Logger logger = LoggerFactory.getLogger(RaceDetectorConfig.class);

    @Value("${indexing.telemetry.race.detector:store}")
    private String detector;

    @Value("${indexing.telemetry.race.window:10s}")
    private Duration window;

    @Value("${indexing.telemetry.race.kv-ttl:30s}")
    private Duration kvTtl;

    @Bean
    public RaceDetector raceDetector(ObjectProvider<RaceStore> raceStore, ObjectProvider<KvClient> kvClient, ObjectMapper objectMapper) {
        switch (detector.trim().toLowerCase(Locale.ROOT)) {
            case "none":
                logger.info("Race detection disabled");
                return RaceDetector.NONE;
            case "kv":
                logger.info("Race detection via KV cache (window={}, ttl={})", window, kvTtl);
                return new KvRaceDetector(kvClient.getObject(), objectMapper, window, kvTtl);
            case "store":
                RaceStore store = raceStore.getIfAvailable();
                if (store == null) {
                    logger.warn("Race detector 'store' needs a race store, none for this backend; race detection disabled");
                    return RaceDetector.NONE;
                }
                logger.info("Race detection via race store (window={})", window);
                return new StoreRaceDetector(store, window);
            default:
                throw new IllegalArgumentException("Unknown indexing.telemetry.race.detector: " + detector);
        }
    }
}
