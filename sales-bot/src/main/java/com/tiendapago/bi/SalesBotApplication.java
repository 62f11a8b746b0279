package com.tiendapago.bi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SalesBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(SalesBotApplication.class, args);
    }
}
