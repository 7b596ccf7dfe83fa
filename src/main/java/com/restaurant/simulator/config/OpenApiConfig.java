package com.restaurant.simulator.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI dataSimulatorOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Restaurant Data Simulator API")
                        .version("1.0.0")
                        .description(
                                "Deterministic synthetic operational data for restaurant locations.\n\n" +
                                "**Generation Pipeline:**\n" +
                                "1. Fold the location (and optional org) into a seed\n" +
                                "2. Compose a daily sales level: growth trend x weekday x month x weather x holiday x payday x events, plus AR(1) noise\n" +
                                "3. Spread each day over 15-minute buckets with a lunch/dinner demand curve\n" +
                                "4. Derive daily labor, top-10 item mix and ingredient inventory\n\n" +
                                "**Row Families:** `sales_15m`, `labor_daily`, `item_mix_daily`, `inventory_daily`\n\n" +
                                "The same location, org, horizon and reference date always produce the same rows.")
                        .contact(new Contact().name("Data Simulator Team")));
    }
}
