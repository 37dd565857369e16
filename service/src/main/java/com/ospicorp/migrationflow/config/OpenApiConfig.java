package com.ospicorp.migrationflow.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
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
            .title("Migration Flow API")
            .version("v1")
            .description("Chart and flow-diagram data aggregated from the migration data API")
            .contact(new Contact().name("Migration Analytics Team"))
            .license(new License().name("MIT")))
        .servers(List.of(new Server().url("/")));
  }
}
