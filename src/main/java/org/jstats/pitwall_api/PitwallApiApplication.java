package org.jstats.pitwall_api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;

@SpringBootApplication
@EnableRetry
public class PitwallApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(PitwallApiApplication.class, args);
    }
}
