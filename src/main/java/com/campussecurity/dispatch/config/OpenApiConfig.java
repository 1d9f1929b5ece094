package com.campussecurity.dispatch.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI (Swagger) configuration.
 *
 * - Swagger UI: http://localhost:8080/swagger-ui.html
 * - OpenAPI JSON: http://localhost:8080/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI dispatchOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Campus Dispatch Engine API")
                        .description("Incident deduplication and guard dispatch for campus emergency response.\n\n" +
                                "## Flow\n\n" +
                                "1. Signals (student SOS, AI vision/audio detections, panic buttons) arrive at a beacon\n" +
                                "2. Signals at a beacon with an open incident are merged into it\n" +
                                "3. A new incident triggers an expanding-radius search over the beacon graph\n" +
                                "4. The nearest available guards are alerted; the first to accept is assigned\n" +
                                "5. Declines and missed deadlines escalate to the next candidate\n\n" +
                                "## WebSocket\n\n" +
                                "Connect to `ws://localhost:8080/ws/dispatch`\n\n" +
                                "- `/app/guard/location` - guard beacon pings\n" +
                                "- `/user/queue/alerts` - alerts for the connected guard\n" +
                                "- `/topic/incidents` - incident state broadcasts")
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local Development Server")
                ));
    }
}
