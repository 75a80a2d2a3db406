package com.power.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI powerAnomalyOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Power Consumption Anomaly Detection API")
                        .version("1.0.0")
                        .description(
                                "Isolation Forest anomaly detection for household power consumption readings.\n\n" +
                                "**Pipeline:**\n" +
                                "1. Parse `Date;Time;...` readings, dropping malformed rows (`?` marks missing values)\n" +
                                "2. Standardize the 7 features with the scaler fitted at training time\n" +
                                "3. Score each reading with the Isolation Forest (higher = more anomalous)\n" +
                                "4. Label readings whose score reaches the threshold fixed by the contamination rate\n\n" +
                                "**Features:** `Global_active_power`, `Global_reactive_power`, `Voltage`, " +
                                "`Global_intensity`, `Sub_metering_1`, `Sub_metering_2`, `Sub_metering_3`\n\n" +
                                "Train first via `POST /api/v1/train`; every other call reads the published model.")
                        .contact(new Contact().name("Anomaly Detection Team")));
    }
}
