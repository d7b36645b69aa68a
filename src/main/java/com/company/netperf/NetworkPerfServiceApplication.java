package com.company.netperf;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableAsync
@OpenAPIDefinition(
        info = @Info(
                title = "Network Performance Service API",
                version = "1.0.0",
                description = "Network path measurement, history and diagnostics"
        )
)
public class NetworkPerfServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(NetworkPerfServiceApplication.class, args);
    }
}
