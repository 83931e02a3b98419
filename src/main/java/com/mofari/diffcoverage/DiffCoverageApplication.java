package com.mofari.diffcoverage;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
public class DiffCoverageApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(DiffCoverageApplication.class, args);
        // in check mode the run is over once the context has started
        if (context.getEnvironment().getProperty("diff-coverage.check.enabled", Boolean.class, false)) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
