package com.demo.sidecar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DemoSidecarApplication {
    public static void main(String[] args) {
        SpringApplication.run(DemoSidecarApplication.class, args);
    }
}
