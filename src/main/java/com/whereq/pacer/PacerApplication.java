package com.whereq.pacer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for WhereQ Pacer.
 * This service accepts training plan requests, generates the plans in the
 * background and serves the resulting spreadsheets for download.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
public class PacerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PacerApplication.class, args);
    }
}
