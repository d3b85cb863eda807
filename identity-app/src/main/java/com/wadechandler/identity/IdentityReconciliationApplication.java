package com.wadechandler.identity;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class IdentityReconciliationApplication {

    public static void main(String[] args) {
        SpringApplication.run(IdentityReconciliationApplication.class, args);
    }
}
