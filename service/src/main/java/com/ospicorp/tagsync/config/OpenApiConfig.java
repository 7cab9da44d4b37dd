package com.ospicorp.tagsync.config;

import io.swagger.v3.oas.models.ExternalDocumentation;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

  @Bean
  OpenAPI apiInfo() {
    return new OpenAPI()
        .info(new Info()
            .title("TagSync Alignment API")
            .version("v1")
            .description("Resamples instrument exports and merges them onto one timestamp grid")
            .contact(new Contact().name("Process Data Team").email("tagsync-support@example.com")))
        .servers(List.of(new Server().url("/")))
        .externalDocs(new ExternalDocumentation()
            .description("Error codes")
            .url("https://docs.tagsync.dev/errors"));
  }
}
