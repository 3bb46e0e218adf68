package com.openforge.invoicemate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class InvoiceMateApplication {

    public static void main(String[] args) {
        SpringApplication.run(InvoiceMateApplication.class, args);
    }
}
