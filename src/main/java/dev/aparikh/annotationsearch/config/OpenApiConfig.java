package dev.aparikh.annotationsearch.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI annotationSearchOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Annotation Search API")
                        .description("Bulk ingest, search and aggregation of annotated records backed by Apache Solr")
                        .version("v1.0.0")
                        .contact(new Contact()
                                .name("Annotation Search Team")
                                .url("https://github.com/aparikh/annotation-search"))
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")));
    }
}
