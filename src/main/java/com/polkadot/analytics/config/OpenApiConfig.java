package com.polkadot.analytics.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI parachainAnalyticsOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Parachain Analytics API")
                        .version("1.0.0")
                        .description(
                                "Forecasts, anomaly detection and health insights for parachain metrics.\n\n" +
                                "**Model lifecycle:**\n" +
                                "1. Train a model via `POST /models/forecast/train` or `POST /models/anomaly/train`\n" +
                                "2. History is fetched from the metric store and turned into a feature table " +
                                "(calendar, lag 1/7/30 and rolling 7/30 features)\n" +
                                "3. The fitted model and its feature scaler are persisted under the model cache root\n" +
                                "4. Query `POST /forecasts` or `POST /anomalies/detect`\n\n" +
                                "**Forecast model kinds:** `linear`, `rf`, `gbm`, `ensemble` (gradient boosting)\n\n" +
                                "**Anomaly methods:**\n" +
                                "- `isolation_forest`: tree-ensemble outlier model, ~10% training contamination\n" +
                                "- `statistical`: two-sided z-score against the training baseline\n\n" +
                                "**Insights:** rule-based trend, volatility, weekly pattern and health observations " +
                                "via `POST /insights`")
                        .contact(new Contact().name("Parachain Analytics Team")));
    }
}
