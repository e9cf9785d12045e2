package com.dqscan.quality.config;

import java.util.List;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;

@Configuration
public class OpenApiConfig {

  @Value("${springdoc.info.title:Data Quality Report API}")
  private String title;

  @Value("${springdoc.info.version:1.0.0}")
  private String version;

  @Value(
      "${springdoc.info.description:Builds data-quality reports for uploaded CSV and Excel datasets: missing values, duplicate rows, outliers, target-column inference and label issues.}")
  private String description;

  @Value("${server.port:8080}")
  private String serverPort;

  @Bean
  public OpenAPI qualityReportOpenAPI() {
    return new OpenAPI()
        .info(
            new Info()
                .title(title)
                .version(version)
                .description(description)
                .license(
                    new License()
                        .name("Apache 2.0")
                        .url("https://www.apache.org/licenses/LICENSE-2.0")))
        .servers(
            List.of(
                new Server()
                    .url("http://localhost:" + serverPort)
                    .description("Local development server")))
        .tags(
            List.of(
                new Tag().name("Quality Report").description("Dataset quality analysis"),
                new Tag().name("Health").description("Service liveness")));
  }
}
