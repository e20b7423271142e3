package com.flagship.ledger_query;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Read-only query service over the platform ledger.
 */
@SpringBootApplication
public class LedgerQueryApplication {

    public static void main(String[] args) {
        SpringApplication.run(LedgerQueryApplication.class, args);
    }
}
