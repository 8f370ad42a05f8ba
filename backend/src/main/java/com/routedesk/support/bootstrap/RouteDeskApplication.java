package com.routedesk.support.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication(scanBasePackages = "com.routedesk.support")
@ConfigurationPropertiesScan(basePackages = "com.routedesk.support")
public class RouteDeskApplication {
    public static void main(String[] args) {
        SpringApplication.run(RouteDeskApplication.class, args);
    }
}
