package com.polkadot.analytics.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "analytics")
public class AnalyticsConfig {

    // Root directory for persisted model artifacts. One file per (entity, metric, variant).
    private String modelCacheDir = "models/cache";

    // Gap-fill strategy used when deriving features: forward, backward or interpolate.
    private String defaultFillMethod = "forward";

    // History fetched for training and retraining.
    private int historicalDataDays = 365;
    private int fetchLimit = 1000;

    private Forecast forecast = new Forecast();

    private Anomaly anomaly = new Anomaly();

    private Insights insights = new Insights();

    private Retrain retrain = new Retrain();

    @Data
    public static class Forecast {
        private boolean enabled = true;
        private int minTrainingRows = 30;
        private double trainSplit = 0.8;
        private int defaultHorizonDays = 7;
        private int maxHorizonDays = 365;
        private String defaultModelKind = "ensemble";
        private int numTrees = 100;
        private long seed = 42;
    }

    @Data
    public static class Anomaly {
        private boolean enabled = true;
        private int minTrainingRows = 50;
        // Share of training points the isolation forest treats as outliers.
        private double contamination = 0.1;
        private int numTrees = 100;
        private int sampleSize = 256;
        private long seed = 42;
        private double defaultSensitivity = 0.05;
        private String defaultMethod = "isolation_forest";
        private int recentLookbackDays = 7;
        // Extra history fetched ahead of the scoring window so lag features are defined.
        private int warmupDays = 30;
        private double highSeverityScore = 0.7;
        private double highSeverityZScore = 3.0;
    }

    @Data
    public static class Insights {
        private int maxInsights = 10;
        private double confidence = 0.85;
        private int defaultTimeRangeDays = 30;
        private List<String> trackedMetrics = List.of("tvl", "transactions", "users");
        private String tvlMetric = "tvl";
        private String transactionsMetric = "transactions";
        private String usersMetric = "users";
        private int outlookHorizonDays = 7;
        private Enhancer enhancer = new Enhancer();
    }

    @Data
    public static class Enhancer {
        private boolean enabled = false;
        private String endpoint = "https://api.openai.com/v1/chat/completions";
        private String apiKey;
        private String model = "gpt-3.5-turbo";
        private int maxTokens = 300;
        private double temperature = 0.7;
        private int timeoutSeconds = 20;
    }

    @Data
    public static class Retrain {
        private boolean enabled = true;
        private int intervalHours = 24;
    }
}
