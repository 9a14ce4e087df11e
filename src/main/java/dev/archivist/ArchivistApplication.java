package dev.archivist;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the Archivist retrieval engine.
 *
 * <p>Serves the retrieval REST API and the MCP tool endpoint on port 8080.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ArchivistApplication {
    public static void main(String[] args) {
        SpringApplication.run(ArchivistApplication.class, args);
    }
}
