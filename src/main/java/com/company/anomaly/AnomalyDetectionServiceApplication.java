package com.company.anomaly;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableCaching
@EnableScheduling
@OpenAPIDefinition(
        info = @Info(
                title = "Workflow Anomaly Detection API",
                version = "1.0.0",
                description = "Statistical anomaly detection over workflow execution telemetry"
        )
)
public class AnomalyDetectionServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnomalyDetectionServiceApplication.class, args);
    }
}
