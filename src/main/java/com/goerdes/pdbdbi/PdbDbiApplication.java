package com.goerdes.pdbdbi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PdbDbiApplication {

    public static void main(String[] args) {
        SpringApplication.run(PdbDbiApplication.class, args);
    }

}
