package com.tenex.sync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TenexSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(TenexSyncApplication.class, args);
    }
}
