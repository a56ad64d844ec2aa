package com.demo.lending.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {
    @Bean
    public OpenAPI lendingOpenAPI(LendingProperties props) {
        return new OpenAPI().info(new Info()
                .title("Lending Pool API")
                .description("Collateral, borrowing, repayment, crowdfunding and mint log endpoints")
                .version(props.getVersion()));
    }
}
