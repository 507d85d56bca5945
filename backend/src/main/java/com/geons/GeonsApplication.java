package com.geons;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GeonsApplication {

    public static void main(String[] args) {
        SpringApplication.run(GeonsApplication.class, args);
    }
}
