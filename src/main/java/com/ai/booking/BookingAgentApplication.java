package com.ai.booking;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BookingAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(BookingAgentApplication.class, args);
    }
}
