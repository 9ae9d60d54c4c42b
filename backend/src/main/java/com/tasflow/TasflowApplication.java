package com.tasflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TasflowApplication {

    public static void main(String[] args) {
        SpringApplication.run(TasflowApplication.class, args);
    }
}
