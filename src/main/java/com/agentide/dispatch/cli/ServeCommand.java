package com.agentide.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: agentide serve
 * <p>
 * Starts the HTTP server exposing the session API and SSE streams. The web server is switched
 * on by {@link com.agentide.AgentIdeApplication#main} when "serve" is among the arguments, and
 * {@link CliRunner} skips picocli in that case, so {@link #run()} only serves {@code --help}.
 * The banner is printed once the server reports its port.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the AgentIDE HTTP server")
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
        ConsoleOutput.info("AgentIDE server running on port " + port);
        System.out.println();
        System.out.println("  API:     http://localhost:" + port + "/api/v1/sessions");
        System.out.println("  Health:  http://localhost:" + port + "/api/v1/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
