package org.bookstore.inventory.config;

import org.springframework.context.annotation.Configuration;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.info.License;
import io.swagger.v3.oas.annotations.servers.Server;

@Configuration
@OpenAPIDefinition(
    info =
        @Info(
            title = "Bookstore Service",
            version = "1.0",
            description =
                "Books, publishers, reading lists and stock-alert notification preferences",
            license = @License(name = "MIT", url = "https://opensource.org/licenses/MIT")),
    servers = {@Server(url = "http://localhost:8080", description = "Local environment")})
public class OpenApiConfig {}
