package com.structo.shortener;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StructoShortenerApplication {

    public static void main(String[] args) {
        SpringApplication.run(StructoShortenerApplication.class, args);
    }
}
