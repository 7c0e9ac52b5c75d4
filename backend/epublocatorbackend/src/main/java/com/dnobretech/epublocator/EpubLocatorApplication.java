package com.dnobretech.epublocator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EpubLocatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(EpubLocatorApplication.class, args);
    }
}
