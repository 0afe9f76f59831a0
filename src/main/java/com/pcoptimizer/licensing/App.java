package com.pcoptimizer.licensing;

import com.pcoptimizer.licensing.config.AppProperties;
import com.pcoptimizer.licensing.config.LicenseProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * PC Optimizer license server.
 */
@SpringBootApplication
@EnableConfigurationProperties({AppProperties.class, LicenseProperties.class})
public class App {
    public static void main(String[] args) {
        SpringApplication.run(App.class, args);
    }
}
