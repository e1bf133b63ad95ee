package com.gillianbc.networth;

import com.gillianbc.networth.config.ProjectionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ProjectionProperties.class)
public class NetWorthForecastApplication {

    public static void main(String[] args) {
        SpringApplication.run(NetWorthForecastApplication.class, args);
    }
}
