package com.phoenixdash.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * Dashboard backend entry point.
 */
@SpringBootApplication
@ComponentScan(basePackages = "com.phoenixdash")
public class PhoenixDashApplication {

    public static void main(String[] args) {
        SpringApplication.run(PhoenixDashApplication.class, args);
    }
}
