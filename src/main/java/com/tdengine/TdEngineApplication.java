package com.tdengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TdEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(TdEngineApplication.class, args);
    }
}
