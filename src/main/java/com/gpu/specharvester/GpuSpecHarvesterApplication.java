package com.gpu.specharvester;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class GpuSpecHarvesterApplication {

    public static void main(String[] args) {
        SpringApplication.run(GpuSpecHarvesterApplication.class, args);
    }
}
