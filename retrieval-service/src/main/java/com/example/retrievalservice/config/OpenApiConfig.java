package com.example.retrievalservice.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI/Swagger configuration for the Retrieval Service.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI(@Value("${retrieval.mail.contact:rds@localhost}") String contactEmail) {
        return new OpenAPI()
                .info(new Info()
                        .title("Archive Retrieval Service API")
                        .version("1.0.0")
                        .description("""
                            Asynchronous retrieval of archived collections from tape storage.

                            ## Flow
                            1. Submit a request with `/sds/pull`; the job is queued and an email follows
                            2. The worker stages the collection and marks the job completed
                            3. Download tokens bound the number of downloads and their lifetime

                            ## Job statuses
                            - **submitted**: queued
                            - **processing**: being staged
                            - **completed**: ready to download
                            - **failed** / **cancelled**: terminal
                            """)
                        .contact(new Contact()
                                .name("Research Data Services")
                                .email(contactEmail)));
    }
}
