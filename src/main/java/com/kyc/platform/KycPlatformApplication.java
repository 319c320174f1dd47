package com.kyc.platform;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KycPlatformApplication {

    public static void main(String[] args) {
        SpringApplication.run(KycPlatformApplication.class, args);
    }
}
