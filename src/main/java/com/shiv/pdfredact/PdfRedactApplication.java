package com.shiv.pdfredact;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PdfRedactApplication {

    public static void main(String[] args) {
        SpringApplication.run(PdfRedactApplication.class, args);
    }
}
