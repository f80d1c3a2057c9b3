package com.whereq.newscaster;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for WhereQ Newscaster.
 * This service turns batches of news articles into lip-synced avatar videos
 * by driving an external render service and tracking its asynchronous jobs.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
public class NewscasterApplication {

    public static void main(String[] args) {
        SpringApplication.run(NewscasterApplication.class, args);
    }
}
