package com.lynkvertx.expower.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI (Swagger) Configuration
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI expowerOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("EXPOWER API")
                .description("Expander power-generation skid sizing: losses, utility consumption, "
                    + "net power, annual economics and unit selection")
                .version("0.1.0")
                .contact(new Contact()
                    .name("EXPOWER Team")
                    .email("support@lynkvertx.com"))
                .license(new License()
                    .name("Proprietary")));
    }
}
