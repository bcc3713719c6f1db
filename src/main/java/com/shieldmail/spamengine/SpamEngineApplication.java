package com.shieldmail.spamengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SpamEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpamEngineApplication.class, args);
    }
}
