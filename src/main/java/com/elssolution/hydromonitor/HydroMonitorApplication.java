package com.elssolution.hydromonitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HydroMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(HydroMonitorApplication.class, args);
    }

}
