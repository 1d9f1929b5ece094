package com.campussecurity.dispatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main entry point for the Campus Dispatch Engine.
 *
 * Annotations:
 * - @EnableCaching: beacon-graph snapshot cache (Redis in production)
 * - @EnableAsync: guard push notifications are delivered off the request thread
 * - @EnableScheduling: periodic sweep that expires overdue guard alerts
 *
 * Flow:
 * 1. A signal (student SOS, AI detection, panic button) arrives at a beacon
 * 2. The incident store merges it into the beacon's open incident or opens a new one
 * 3. New incidents trigger an expanding-radius search over the beacon graph
 * 4. The nearest available guards are alerted and race to accept
 * 5. Declines and expired deadlines escalate to the next candidate
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableCaching
@EnableAsync
@EnableScheduling
public class DispatchEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(DispatchEngineApplication.class, args);
    }
}
