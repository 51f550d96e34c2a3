package com.otpguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OtpGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(OtpGuardApplication.class, args);
    }
}
