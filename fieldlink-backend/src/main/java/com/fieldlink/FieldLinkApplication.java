package com.fieldlink;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FieldLinkApplication {

    public static void main(String[] args) {
        SpringApplication.run(FieldLinkApplication.class, args);
    }
}
