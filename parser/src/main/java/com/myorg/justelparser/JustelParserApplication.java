package com.myorg.justelparser;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class JustelParserApplication {

    public static void main(String[] args) {
        SpringApplication.run(JustelParserApplication.class, args);
    }
}
