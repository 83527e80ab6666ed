package com.plangraph;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;

/**
 * Entry point of the {@code plangraph} command. Starts a non-web context, runs
 * one command and exits with its status.
 */
@SpringBootApplication
public class PlangraphApplication {

    public static void main(String[] args) {
        ApplicationContext ctx = new SpringApplicationBuilder(PlangraphApplication.class)
                .properties(
                        "spring.main.web-application-type=none",
                        "spring.main.banner-mode=off"
                )
                .run(args);

        // the command has already run inside CliRunner; propagate its status
        int exitCode = SpringApplication.exit(ctx, ctx.getBean(ExitCodeGenerator.class));
        System.exit(exitCode);
    }
}
