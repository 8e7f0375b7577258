package org.operaton.activslot;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main Spring Boot application class for Activslot.
 * Activslot plans daily walks and workouts around the user's calendar and can schedule
 * the next day's walks on its own.
 */
@SpringBootApplication
@EnableScheduling
@Slf4j
public class ActivslotApplication {

    public static void main(String[] args) {
        SpringApplication.run(ActivslotApplication.class, args);
        log.info("Activslot application started successfully!");
    }
}
