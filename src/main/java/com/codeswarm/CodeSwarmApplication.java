package com.codeswarm;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CodeSwarmApplication {

    public static void main(String[] args) {
        SpringApplication.run(CodeSwarmApplication.class, args);
    }
}
