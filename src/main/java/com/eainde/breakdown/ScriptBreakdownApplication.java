package com.eainde.breakdown;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ScriptBreakdownApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScriptBreakdownApplication.class, args);
    }
}
