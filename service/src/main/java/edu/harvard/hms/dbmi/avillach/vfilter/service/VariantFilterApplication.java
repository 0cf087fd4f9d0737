package edu.harvard.hms.dbmi.avillach.vfilter.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

@SpringBootApplication
@ComponentScan("edu.harvard.hms.dbmi.avillach.vfilter")
public class VariantFilterApplication {

    public static void main(String[] args) {
        SpringApplication.run(VariantFilterApplication.class, args);
    }

}
