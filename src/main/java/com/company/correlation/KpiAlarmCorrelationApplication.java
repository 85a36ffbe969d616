package com.company.correlation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KpiAlarmCorrelationApplication {

    public static void main(String[] args) {
        SpringApplication.run(KpiAlarmCorrelationApplication.class, args);
    }
}
