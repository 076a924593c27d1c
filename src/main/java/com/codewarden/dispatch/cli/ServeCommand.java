package com.codewarden.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: codewarden serve
 * <p>
 * Starts the HTTP server exposing the REST API and the realtime WebSocket
 * channel. The web server is enabled by
 * {@link com.codewarden.CodewardenApplication#main} detecting "serve" in args;
 * the banner is printed once the server is ready.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 codewarden serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Codewarden HTTP and WebSocket server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Not called in serve mode; CliRunner skips picocli.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Codewarden server running on port " + port);
        System.out.println();
        System.out.println("  API:        http://localhost:" + port + "/api/v1");
        System.out.println("  Realtime:   ws://localhost:" + port + "/ws/realtime");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
