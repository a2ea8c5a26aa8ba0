package com.bridgewatcher;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Bridge watcher node: scans the source ledger for bridge transfers and forwards them for attestation.
 */
@SpringBootApplication
public class BridgeWatcherApplication {

    public static void main(String[] args) {
        SpringApplication.run(BridgeWatcherApplication.class, args);
    }
}
