package org.holdem;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling  // idle-table sweep
@EnableAsync       // hand history is written off the table workers
public class HoldemApplication {
    public static void main(String[] args) {
        SpringApplication.run(HoldemApplication.class, args);
    }
}
