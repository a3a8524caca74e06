package org.budgetanalyzer.changefeed.config;

import org.springframework.context.annotation.Configuration;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.info.License;
import io.swagger.v3.oas.annotations.servers.Server;

@Configuration
@OpenAPIDefinition(
    info =
        @Info(
            title = "Changefeed Service",
            version = "1.0",
            description =
                "Ordered, replayable changefeed per shard: cursor reads, promotion, backfill and"
                    + " outbox staging",
            license = @License(name = "MIT", url = "https://opensource.org/licenses/MIT")),
    servers = {
      @Server(url = "http://localhost:8080/api", description = "Local environment (via gateway)"),
      @Server(
          url = "http://localhost:8086/changefeed-service",
          description = "Local environment (direct)")
    })
public class OpenApiConfig {}
