package com.flagship.pawn_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PawnLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PawnLedgerApplication.class, args);
    }
}
