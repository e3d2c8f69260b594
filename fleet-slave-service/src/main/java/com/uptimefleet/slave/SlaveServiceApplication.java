package com.uptimefleet.slave;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Slave Service Application
 * Runs health checks for assigned services and reports results to the master
 */
@SpringBootApplication
@EnableScheduling
public class SlaveServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(SlaveServiceApplication.class, args);
    }
}
