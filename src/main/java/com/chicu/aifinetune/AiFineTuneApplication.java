package com.chicu.aifinetune;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.chicu.aifinetune")
public class AiFineTuneApplication {

    public static void main(String[] args) {
        SpringApplication.run(AiFineTuneApplication.class, args);
    }
}
