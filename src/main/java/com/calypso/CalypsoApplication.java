package com.calypso;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CalypsoApplication {

    public static void main(String[] args) {
        SpringApplication.run(CalypsoApplication.class, args);
    }
}
