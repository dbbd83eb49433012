package com.ferrybooking;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableFeignClients(basePackages = "com.ferrybooking.payment.client")
@EnableScheduling
@EnableRetry
public class FerryBookingApplication {

    public static void main(String[] args) {
        SpringApplication.run(FerryBookingApplication.class, args);
    }
}
