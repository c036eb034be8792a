package com.rcpilot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RcPilotApplication {

    public static void main(String[] args) {
        SpringApplication.run(RcPilotApplication.class, args);
    }
}
