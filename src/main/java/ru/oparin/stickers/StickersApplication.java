package ru.oparin.stickers;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StickersApplication {

    public static void main(String[] args) {
        SpringApplication.run(StickersApplication.class, args);
    }
}
