package com.stealerlens;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for StealerLens.
 *
 * StealerLens normalizes the text artifacts found in infostealer log archives:
 * - system information files from 24 stealer families plus a generic fallback
 *   are turned into one host metadata record each
 * - browser password dumps are split into credential records ready for storage
 *
 * @author StealerLens Team
 * @version 1.0.0
 */
@SpringBootApplication
public class StealerLensApplication {

    /**
     * Main entry point for the StealerLens application.
     *
     * @param args command line arguments
     */
    public static void main(String[] args) {
        SpringApplication.run(StealerLensApplication.class, args);
    }
}
