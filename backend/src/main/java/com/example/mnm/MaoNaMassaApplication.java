package com.example.mnm;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MaoNaMassaApplication {

    public static void main(String[] args) {
        SpringApplication.run(MaoNaMassaApplication.class, args);
    }
}
