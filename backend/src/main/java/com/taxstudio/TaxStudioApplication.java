package com.taxstudio;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TaxStudioApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaxStudioApplication.class, args);
    }
}
