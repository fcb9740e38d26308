package com.example.indexingtelemetry;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class IndexingTelemetryApplication {

    public static void main(String[] args) {
        SpringApplication.run(IndexingTelemetryApplication.class, args);
    }

}
