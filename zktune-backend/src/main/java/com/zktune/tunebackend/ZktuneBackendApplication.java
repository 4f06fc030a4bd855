package com.zktune.tunebackend;

import com.zktune.tunebackend.ledger.StreamingLedger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

@Slf4j
@SpringBootApplication
public class ZktuneBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(ZktuneBackendApplication.class, args);
    }

    // Seed a demo creator and track on startup (local runs only)
    @Bean
    public CommandLineRunner seedDemoCatalog(StreamingLedger ledger,
                                             @Value("${app.seed.demo:false}") boolean seedDemo) {
        return args -> {
            if (!seedDemo) return;
            String demoCreator = "demo-creator";
            if (ledger.creatorSummary(demoCreator).isEmpty()) {
                ledger.registerCreator(demoCreator, "Demo Creator", "profiles/demo-creator.json");
                Long trackId = ledger.publish(demoCreator, "Demo Track", "audio/demo.mp3", "covers/demo.jpg", 1000L, null);
                log.info("Demo catalog seeded: creator {} track {}", demoCreator, trackId);
            } else {
                log.info("Demo catalog already present");
            }
        };
    }
}
