package com.askbetter.core.llm;

import com.askbetter.core.error.ConfigurationException;
import com.askbetter.core.model.GenerationSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "askbetter.llm")
public class LlmProperties {

    private String apiKey = "";
    private String baseUrl = "https://api.openai.com";
    private String model = "gpt-4o-mini";
    private double temperature = 0.0;
    private Integer seed;
    private Duration timeout = Duration.ofSeconds(60);

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        this.temperature = temperature;
    }

    public Integer getSeed() {
        return seed;
    }

    public void setSeed(Integer seed) {
        this.seed = seed;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    /**
     * Settings used when a request does not override them.
     */
    public GenerationSettings defaultSettings() {
        return new GenerationSettings(model, temperature, seed);
    }

    /**
     * Fails fast on settings that would make every request fail.
     *
     * @throws ConfigurationException if the API key is missing, the base URL is not an
     *                                absolute http(s) URL, or the model is blank
     */
    public void requireValid() {
        if (!hasApiKey()) {
            throw new ConfigurationException("OPENAI_API_KEY is not set (askbetter.llm.api-key)");
        }
        if (model == null || model.isBlank()) {
            throw new ConfigurationException("No model configured (askbetter.llm.model)");
        }
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new ConfigurationException("No base URL configured (askbetter.llm.base-url)");
        }
        try {
            URI uri = new URI(baseUrl);
            if (!uri.isAbsolute() || !("http".equals(uri.getScheme()) || "https".equals(uri.getScheme()))) {
                throw new ConfigurationException("askbetter.llm.base-url must be an absolute http(s) URL: " + baseUrl);
            }
        } catch (URISyntaxException e) {
            throw new ConfigurationException("askbetter.llm.base-url is malformed: " + baseUrl, e);
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new ConfigurationException("askbetter.llm.timeout must be positive");
        }
        if (temperature < 0.0 || temperature > 2.0) {
            throw new ConfigurationException("askbetter.llm.temperature must be within [0, 2]: " + temperature);
        }
    }
}
