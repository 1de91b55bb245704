package com.infra.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ContainerAnomalyApplication {

    public static void main(String[] args) {
        SpringApplication.run(ContainerAnomalyApplication.class, args);
    }
}
