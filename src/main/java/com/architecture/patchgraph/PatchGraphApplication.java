package com.architecture.patchgraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PatchGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(PatchGraphApplication.class, args);
    }
}
