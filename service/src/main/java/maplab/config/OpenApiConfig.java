package maplab.config;

import io.swagger.v3.oas.models.ExternalDocumentation;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

  @Bean
  OpenAPI apiInfo(@Value("${maplab.api.version:v1}") String version) {
    return new OpenAPI()
        .info(new Info()
            .title("ECU Map Lab API")
            .version(version)
            .description("Parses ECU calibration map tables into dense, gap-free grids")
            .contact(new Contact().name("Map Lab Team").email("maplab-support@example.com"))
            .license(new License().name("MIT")))
        .servers(List.of(new Server().url("/")))
        .externalDocs(new ExternalDocumentation()
            .description("Map file format")
            .url("https://docs.maplab.dev/maps/format"));
  }
}
