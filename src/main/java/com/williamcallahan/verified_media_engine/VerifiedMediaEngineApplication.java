package com.williamcallahan.verified_media_engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point of the verified media selection service
 */
@SpringBootApplication
public class VerifiedMediaEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(VerifiedMediaEngineApplication.class, args);
    }
}
