package com.flagship.group_access;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point for the group access ledger.
 *
 * Hosts payment ingestion, the subscription ledger, access finalization,
 * reconciliation against the platform's transaction ledger and the lifecycle sweep.
 */
@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class GroupAccessLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(GroupAccessLedgerApplication.class, args);
    }
}
