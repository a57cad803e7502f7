package com.chicu.botjobs;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.chicu.botjobs")
public class BotJobsApplication {

    public static void main(String[] args) {
        SpringApplication.run(BotJobsApplication.class, args);
    }
}
