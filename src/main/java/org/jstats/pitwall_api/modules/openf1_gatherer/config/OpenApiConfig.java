package org.jstats.pitwall_api.modules.openf1_gatherer.config;

import io.swagger.v3.oas.models.ExternalDocumentation;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    OpenAPI apiInfo() {
        return new OpenAPI()
                .info(new Info()
                        .title("Pitwall Strategy API")
                        .description("Hybrid-trained F1 race-strategy models: tire, pit stop, race pace and position.")
                        .version("v1")
                        .contact(new Contact().name("Pitwall"))
                        .license(new License().name("Apache 2.0")))
                .externalDocs(new ExternalDocumentation()
                        .description("OpenF1 telemetry source")
                        .url("https://openf1.org"));
    }
}
