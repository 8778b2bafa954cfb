package com.example.podpairing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PodPairingApplication {

    public static void main(String[] args) {
        SpringApplication.run(PodPairingApplication.class, args);
    }
}
