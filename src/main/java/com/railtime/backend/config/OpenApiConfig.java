package com.railtime.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ViewControllerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

@Configuration
public class OpenApiConfig implements WebMvcConfigurer {

        /**
         * Maps the "/docs" URL to the Swagger UI.
         */
        @Override
        public void addViewControllers(ViewControllerRegistry registry) {
                registry.addRedirectViewController("/docs", "/swagger-ui.html");
                registry.addRedirectViewController("/docs/", "/swagger-ui.html");
        }

        @Bean
        public OpenAPI railtimeOpenAPI() {
                return new OpenAPI()
                                .info(new Info()
                                                .title("Railtime API documentation")
                                                .description(
                                                                "### Railtime API\n\n" +
                                                                                "Caching proxy in front of the MARTA real-time rail arrivals feed. "
                                                                                +
                                                                                "Arrivals are cached for a minute, concurrent requests share a single upstream call, "
                                                                                +
                                                                                "and the last good snapshot is served (flagged as stale) while MARTA is unavailable.\n\n"
                                                                                +
                                                                                "#### Cache metadata\n" +
                                                                                "- **hit**: served from the cache without a fresh upstream call.\n"
                                                                                +
                                                                                "- **stale**: the upstream refresh failed and an older snapshot was returned.\n"
                                                                                +
                                                                                "- **ageMs**: age of the returned snapshot in milliseconds.")
                                                .version("v1.0.0")
                                                .license(new License()
                                                                .name("Apache 2.0")
                                                                .url("http://springdoc.org")))
                                .servers(List.of(
                                                new Server().url("http://localhost:8080")
                                                                .description("Local Development (HTTP)")));
        }
}
