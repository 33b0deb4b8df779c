package com.athl3t.backend.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    public static final String USER_HEADER = "X-User-Id";

    @Bean
    public OpenAPI athl3tOpenApi() {
        SecurityScheme userHeader = new SecurityScheme()
                .type(SecurityScheme.Type.APIKEY)
                .in(SecurityScheme.In.HEADER)
                .name(USER_HEADER);
        return new OpenAPI()
                .info(new Info()
                        .title("ATHL3T Trades Ledger & Settlement API")
                        .version("1.0"))
                .components(new Components().addSecuritySchemes("userHeader", userHeader))
                .addSecurityItem(new SecurityRequirement().addList("userHeader"));
    }
}
