package com.sheetlex.formula;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SheetlexApplication {

    public static void main(String[] args) {
        SpringApplication.run(SheetlexApplication.class, args);
    }
}
