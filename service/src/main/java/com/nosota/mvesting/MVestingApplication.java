package com.nosota.mvesting;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MVestingApplication {
    public static void main(String[] args) {
        SpringApplication.run(MVestingApplication.class, args);
    }
}
