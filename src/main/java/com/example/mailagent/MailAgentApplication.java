package com.example.mailagent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MailAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(MailAgentApplication.class, args);
    }
}
