package com.theset.setlist;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class TheSetApplication {

    public static void main(String[] args) {
        SpringApplication.run(TheSetApplication.class, args);
    }
}
