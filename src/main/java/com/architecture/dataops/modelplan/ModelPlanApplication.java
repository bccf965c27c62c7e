package com.architecture.dataops.modelplan;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ModelPlanApplication {

    public static void main(String[] args) {
        SpringApplication.run(ModelPlanApplication.class, args);
    }
}
