package com.sheetdoc.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SheetDocApplication {

    public static void main(String[] args) {
        SpringApplication.run(SheetDocApplication.class, args);
    }
}
