package com.team.formtest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FormTestApplication {

    public static void main(String[] args) {
        SpringApplication.run(FormTestApplication.class, args);
    }
}
