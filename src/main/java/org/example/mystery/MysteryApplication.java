package org.example.mystery;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MysteryApplication {

    public static void main(String[] args) {
        SpringApplication.run(MysteryApplication.class, args);
    }
}
