package com.smartsched.timetable_engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TimetableEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(TimetableEngineApplication.class, args);
    }
}
