package com.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan({"com.bootstrap.shared.config", "com.bootstrap.billing.config", "com.bootstrap.edge.config"})
public class SaasBootstrapApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(SaasBootstrapApplication.class, args)));
    }
}
