package com.dcruver.notegraph;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the note graph extractor.
 *
 * Reads a directory of outline notes and turns it into a typed node and
 * relationship model that a bulk loader can copy into a property-graph store.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class NoteGraphApplication {

    public static void main(String[] args) {
        log.info("Starting Note Graph extractor...");
        SpringApplication.run(NoteGraphApplication.class, args);
    }
}
