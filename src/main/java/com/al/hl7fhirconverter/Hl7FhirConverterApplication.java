package com.al.hl7fhirconverter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class Hl7FhirConverterApplication {

    public static void main(String[] args) {
        SpringApplication.run(Hl7FhirConverterApplication.class, args);
    }
}
