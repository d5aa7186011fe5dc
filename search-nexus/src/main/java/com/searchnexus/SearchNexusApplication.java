package com.searchnexus;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SearchNexusApplication {

    public static void main(String[] args) {
        SpringApplication.run(SearchNexusApplication.class, args);
    }
}
