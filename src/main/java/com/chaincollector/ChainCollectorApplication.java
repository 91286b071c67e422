package com.chaincollector;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ChainCollectorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChainCollectorApplication.class, args);
    }
}
