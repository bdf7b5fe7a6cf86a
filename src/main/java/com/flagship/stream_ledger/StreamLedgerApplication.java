package com.flagship.stream_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StreamLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(StreamLedgerApplication.class, args);
    }
}
