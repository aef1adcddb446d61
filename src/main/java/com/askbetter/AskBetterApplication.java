package com.askbetter;

import com.askbetter.core.error.ConfigurationException;
import com.askbetter.dispatch.cli.AskBetterCommand;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
public class AskBetterApplication {

    public static void main(String[] args) {
        SpringApplicationBuilder builder = new SpringApplicationBuilder(AskBetterApplication.class)
                .properties(
                        "spring.main.web-application-type=none",
                        "spring.main.banner-mode=off"
                );

        ConfigurableApplicationContext ctx;
        try {
            ctx = builder.run(args);
        } catch (RuntimeException e) {
            // Credentials are checked while the context starts
            ConfigurationException configError = configurationFailure(e);
            if (configError == null) {
                throw e;
            }
            System.err.println(AskBetterCommand.errorJson(configError));
            System.exit(AskBetterCommand.EXIT_CONFIGURATION);
            return;
        }

        ExitCodeGenerator exitCodeGen = ctx.getBean(ExitCodeGenerator.class);
        int exitCode = SpringApplication.exit(ctx, exitCodeGen);
        System.exit(exitCode);
    }

    static ConfigurationException configurationFailure(Throwable t) {
        Throwable cause = t;
        while (cause != null) {
            if (cause instanceof ConfigurationException configError) {
                return configError;
            }
            if (cause.getCause() == cause) {
                break;
            }
            cause = cause.getCause();
        }
        return null;
    }
}
