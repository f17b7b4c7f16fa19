package com.example.mltranslation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MlTranslationApplication {

    public static void main(String[] args) {
        SpringApplication.run(MlTranslationApplication.class, args);
    }
}
