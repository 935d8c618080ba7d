package com.kakeibo.ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KakeiboLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(KakeiboLedgerApplication.class, args);
    }
}
