package dev.scriptorium;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the Scriptorium index lifecycle manager.
 *
 * <p>Supports two Spring profiles: {@code web} (MCP SSE on port 8080)
 * and {@code stdio} (MCP stdio transport, no web server).
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ScriptoriumApplication {
    public static void main(String[] args) {
        SpringApplication.run(ScriptoriumApplication.class, args);
    }
}
