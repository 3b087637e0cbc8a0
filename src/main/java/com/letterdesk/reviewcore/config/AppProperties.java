package com.letterdesk.reviewcore.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix="app")
public class AppProperties {
    private Providers providers = new Providers();
    private Outbox outbox = new Outbox();
    private Sweeper sweeper = new Sweeper();

    public Providers getProviders(){ return providers; }
    public Outbox getOutbox(){ return outbox; }
    public Sweeper getSweeper(){ return sweeper; }

    public static class Providers {
        private Primary primary = new Primary();
        private Fallback fallback = new Fallback();
        private Retry retry = new Retry();
        /** Generated letters shorter than this are treated as empty. */
        private int minContentLength = 100;

        public Primary getPrimary(){ return primary; }
        public Fallback getFallback(){ return fallback; }
        public Retry getRetry(){ return retry; }
        public int getMinContentLength(){ return minContentLength; }
        public void setMinContentLength(int minContentLength){ this.minContentLength = minContentLength; }
    }

    public static class Primary {
        private String url;
        private String authToken;
        private String source = "letterdesk";
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(90);
        private Duration overallTimeout = Duration.ofSeconds(120);

        public String getUrl(){ return url; }
        public void setUrl(String url){ this.url = url; }
        public String getAuthToken(){ return authToken; }
        public void setAuthToken(String authToken){ this.authToken = authToken; }
        public String getSource(){ return source; }
        public void setSource(String source){ this.source = source; }
        public Duration getConnectTimeout(){ return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout){ this.connectTimeout = connectTimeout; }
        public Duration getReadTimeout(){ return readTimeout; }
        public void setReadTimeout(Duration readTimeout){ this.readTimeout = readTimeout; }
        public Duration getOverallTimeout(){ return overallTimeout; }
        public void setOverallTimeout(Duration overallTimeout){ this.overallTimeout = overallTimeout; }
    }

    public static class Fallback {
        private String baseUrl = "https://api.openai.com/v1";
        private String apiKey;
        private String model = "gpt-4-turbo";
        private double temperature = 0.7;
        private int maxTokens = 2048;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(60);

        public String getBaseUrl(){ return baseUrl; }
        public void setBaseUrl(String baseUrl){ this.baseUrl = baseUrl; }
        public String getApiKey(){ return apiKey; }
        public void setApiKey(String apiKey){ this.apiKey = apiKey; }
        public String getModel(){ return model; }
        public void setModel(String model){ this.model = model; }
        public double getTemperature(){ return temperature; }
        public void setTemperature(double temperature){ this.temperature = temperature; }
        public int getMaxTokens(){ return maxTokens; }
        public void setMaxTokens(int maxTokens){ this.maxTokens = maxTokens; }
        public Duration getConnectTimeout(){ return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout){ this.connectTimeout = connectTimeout; }
        public Duration getReadTimeout(){ return readTimeout; }
        public void setReadTimeout(Duration readTimeout){ this.readTimeout = readTimeout; }
    }

    public static class Retry {
        private int maxRetries = 2;
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxJitter = Duration.ofMillis(250);

        public int getMaxRetries(){ return maxRetries; }
        public void setMaxRetries(int maxRetries){ this.maxRetries = maxRetries; }
        public Duration getBaseDelay(){ return baseDelay; }
        public void setBaseDelay(Duration baseDelay){ this.baseDelay = baseDelay; }
        public Duration getMaxJitter(){ return maxJitter; }
        public void setMaxJitter(Duration maxJitter){ this.maxJitter = maxJitter; }
    }

    public static class Outbox {
        private boolean enabled = true;
        private int batchSize = 50;
        private int maxAttempts = 5;

        public boolean isEnabled(){ return enabled; }
        public void setEnabled(boolean enabled){ this.enabled = enabled; }
        public int getBatchSize(){ return batchSize; }
        public void setBatchSize(int batchSize){ this.batchSize = batchSize; }
        public int getMaxAttempts(){ return maxAttempts; }
        public void setMaxAttempts(int maxAttempts){ this.maxAttempts = maxAttempts; }
    }

    public static class Sweeper {
        private boolean enabled = true;
        private Duration stuckAfter = Duration.ofMinutes(10);
        private Duration failAfter = Duration.ofMinutes(60);

        public boolean isEnabled(){ return enabled; }
        public void setEnabled(boolean enabled){ this.enabled = enabled; }
        public Duration getStuckAfter(){ return stuckAfter; }
        public void setStuckAfter(Duration stuckAfter){ this.stuckAfter = stuckAfter; }
        public Duration getFailAfter(){ return failAfter; }
        public void setFailAfter(Duration failAfter){ this.failAfter = failAfter; }
    }
}
