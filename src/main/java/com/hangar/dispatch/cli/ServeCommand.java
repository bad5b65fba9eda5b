package com.hangar.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: hangar serve
 * <p>
 * Runs Hangar as a long-lived HTTP server exposing the project REST API.
 * {@link com.hangar.HangarApplication#main} enables the web server when
 * "serve" is among the arguments and {@link CliRunner} then skips picocli,
 * so {@link #run()} is only reached through {@code --help} style parsing.
 * The banner is printed once Tomcat reports its port.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 hangar serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Hangar HTTP API server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Hangar API listening on port " + port);
        System.out.println();
        System.out.println("  Projects:  http://localhost:" + port + "/api/v1/projects");
        System.out.println("  Health:    http://localhost:" + port + "/api/v1/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
