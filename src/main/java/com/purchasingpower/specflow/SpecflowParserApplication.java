package com.purchasingpower.specflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SpecflowParserApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpecflowParserApplication.class, args);
    }
}
