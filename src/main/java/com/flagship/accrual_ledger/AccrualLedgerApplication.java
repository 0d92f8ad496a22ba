package com.flagship.accrual_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AccrualLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AccrualLedgerApplication.class, args);
    }
}
