package com.al.radiologyfiller.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI documentation. Swagger UI at /swagger-ui.html, JSON at /v3/api-docs.
 */
@Configuration
public class OpenApiConfig {

        @Value("${spring.application.name:radiology-order-filler}")
        private String applicationName;

        @Bean
        public OpenAPI customOpenAPI() {
                return new OpenAPI()
                                .info(new Info()
                                                .title(applicationName + " API")
                                                .version("1.0.0")
                                                .description("""
                                                                Radiology Order Filler.

                                                                ## Features
                                                                - **HL7 Intake**: ORM^O01 orders over REST, MLLP and RabbitMQ
                                                                - **Accession Reconciliation**: Requested Procedure IDs grouped under accession numbers
                                                                - **Accession Generation**: pattern-based numbers with a daily sequence
                                                                - **FHIR R4**: ServiceRequest and ImagingStudy projection and intake
                                                                """)
                                                .contact(new Contact()
                                                                .name("Radiology Integration Team")
                                                                .email("support@example.com")))
                                .servers(List.of(
                                                new Server()
                                                                .url("http://localhost:8080")
                                                                .description("Local Development")))
                                .tags(List.of(
                                                new Tag().name("HL7 Intake")
                                                                .description("Inbound HL7 v2 order messages"),
                                                new Tag().name("Procedure Requests")
                                                                .description("Requested procedures and their workflow status"),
                                                new Tag().name("Accessions")
                                                                .description("Accessions, workflow status and the DICOM study slot"),
                                                new Tag().name("FHIR")
                                                                .description("FHIR R4 ServiceRequest and ImagingStudy"),
                                                new Tag().name("Message Log")
                                                                .description("Audit trail of inbound messages")));
        }
}
