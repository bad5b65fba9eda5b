package com.hangar;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.Arrays;

/**
 * Hangar entry point. {@code hangar serve} runs the REST API on the embedded
 * servlet container; any other invocation runs one picocli command and exits
 * with its status.
 */
@SpringBootApplication
public class HangarApplication {

    public static final String SERVE_COMMAND = "serve";

    public static void main(String[] args) {
        boolean serveMode = isServeMode(args);

        SpringApplicationBuilder builder = new SpringApplicationBuilder(HangarApplication.class)
                .properties("spring.main.banner-mode=off");

        if (serveMode) {
            builder.properties("spring.main.web-application-type=servlet");
        } else {
            // CLI output stays readable: no web server, no startup chatter
            builder.properties(
                    "spring.main.web-application-type=none",
                    "spring.main.log-startup-info=false"
            );
        }

        ConfigurableApplicationContext ctx = builder.run(args);

        if (!serveMode) {
            int exitCode = SpringApplication.exit(ctx, ctx.getBean(ExitCodeGenerator.class));
            System.exit(exitCode);
        }
    }

    public static boolean isServeMode(String... args) {
        return Arrays.asList(args).contains(SERVE_COMMAND);
    }
}
