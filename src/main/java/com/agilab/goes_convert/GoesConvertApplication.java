package com.agilab.goes_convert;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GoesConvertApplication {

    public static void main(String[] args) {
        SpringApplication.run(GoesConvertApplication.class, args);
    }
}
