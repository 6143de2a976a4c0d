package com.bmsedge.envmonitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import lombok.extern.slf4j.Slf4j;

import jakarta.annotation.PostConstruct;
import java.util.TimeZone;

@SpringBootApplication
@Slf4j
public class EnvMonitorApplication {

    /**
     * All telemetry timestamps are UTC, so the JVM default follows.
     */
    @PostConstruct
    public void init() {
        TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
        log.info("========================================");
        log.info("✅ Application timezone set to: {}", TimeZone.getDefault().getID());
        log.info("========================================");
    }

    public static void main(String[] args) {
        SpringApplication.run(EnvMonitorApplication.class, args);
    }
}
