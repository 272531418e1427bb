package com.flagship.exchange_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ExchangeLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ExchangeLedgerApplication.class, args);
    }
}
