package com.example.schemacache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SchemaCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(SchemaCacheApplication.class, args);
    }
}
