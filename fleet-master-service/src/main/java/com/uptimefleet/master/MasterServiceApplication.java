package com.uptimefleet.master;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Master Service Application
 * Assigns services to slaves, ingests their results and keeps uptime state
 */
@SpringBootApplication
@EnableScheduling
public class MasterServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(MasterServiceApplication.class, args);
    }
}
