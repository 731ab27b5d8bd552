package com.goormthonuniv.citeguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class CiteGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(CiteGuardApplication.class, args);
    }
}
