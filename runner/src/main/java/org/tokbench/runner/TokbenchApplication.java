package org.tokbench.runner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication(scanBasePackages = "org.tokbench")
public class TokbenchApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(TokbenchApplication.class, args);
        if (context.getEnvironment().getProperty("tokbench.run.on-startup", Boolean.class, false)) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
