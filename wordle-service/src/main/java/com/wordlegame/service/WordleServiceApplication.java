package com.wordlegame.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class WordleServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(WordleServiceApplication.class, args);
    }
}
