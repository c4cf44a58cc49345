package com.pairchat.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PairChatServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PairChatServerApplication.class, args);
    }
}
