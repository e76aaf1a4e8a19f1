/**
 * Main application class for the omnibus engine
 *
 * @author William Callahan
 *
 * Features:
 * - Splits omnibus EPUBs into virtual books
 * - Serves extracted works from a local cache
 * - Enables scheduling for periodic cache cleanup
 * - Entry point for Spring Boot application
 */

package com.williamcallahan.omnibus_engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class OmnibusEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(OmnibusEngineApplication.class, args);
    }
}
