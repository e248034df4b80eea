package com.whereq.contextforge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for WhereQ ContextForge Pipeline.
 * This service runs the background jobs that classify, optimize, assess and
 * deduplicate curated AI content, and exposes their status over REST.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
@EnableScheduling
public class ContextForgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(ContextForgeApplication.class, args);
    }
}
