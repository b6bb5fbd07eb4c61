package com.example.hoopstats_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HoopstatsBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(HoopstatsBackendApplication.class, args);
    }

}
