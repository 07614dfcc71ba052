package com.flagship.medici_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MediciLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(MediciLedgerApplication.class, args);
    }
}
