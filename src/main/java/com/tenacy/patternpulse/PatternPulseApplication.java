package com.tenacy.patternpulse;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PatternPulseApplication {

    public static void main(String[] args) {
        SpringApplication.run(PatternPulseApplication.class, args);
    }
}
