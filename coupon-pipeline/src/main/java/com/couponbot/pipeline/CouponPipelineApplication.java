package com.couponbot.pipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CouponPipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(CouponPipelineApplication.class, args);
    }
}
