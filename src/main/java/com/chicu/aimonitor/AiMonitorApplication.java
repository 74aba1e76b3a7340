package com.chicu.aimonitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.chicu.aimonitor")
public class AiMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(AiMonitorApplication.class, args);
    }
}
