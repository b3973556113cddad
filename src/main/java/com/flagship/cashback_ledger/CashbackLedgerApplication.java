package com.flagship.cashback_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CashbackLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CashbackLedgerApplication.class, args);
    }
}
