package com.flagship.pocket_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class PocketLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PocketLedgerApplication.class, args);
    }
}
