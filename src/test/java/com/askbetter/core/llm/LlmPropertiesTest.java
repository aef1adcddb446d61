package com.askbetter.core.llm;

import com.askbetter.core.error.ConfigurationException;
import com.askbetter.core.error.ErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class LlmPropertiesTest {

    private LlmProperties properties;

    @BeforeEach
    void setUp() {
        properties = new LlmProperties();
        properties.setApiKey("sk-test");
    }

    @Test
    @DisplayName("defaults are valid once a key is present")
    void defaultsAreValid() {
        assertDoesNotThrow(properties::requireValid);
        assertEquals("gpt-4o-mini", properties.defaultSettings().model());
        assertEquals(0.0, properties.defaultSettings().temperature());
        assertNull(properties.defaultSettings().seed());
    }

    @Test
    @DisplayName("missing API key is a configuration error")
    void missingKey() {
        properties.setApiKey("");
        var e = assertThrows(ConfigurationException.class, properties::requireValid);
        assertEquals(ErrorKind.CONFIGURATION, e.kind());
        assertFalse(e.retryable());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "not a url", "api.openai.com", "ftp://api.openai.com"})
    @DisplayName("base URL must be an absolute http(s) URL")
    void malformedBaseUrl(String baseUrl) {
        properties.setBaseUrl(baseUrl);
        assertThrows(ConfigurationException.class, properties::requireValid);
    }

    @Test
    @DisplayName("non-positive timeout is rejected")
    void timeoutMustBePositive() {
        properties.setTimeout(Duration.ZERO);
        assertThrows(ConfigurationException.class, properties::requireValid);
    }

    @Test
    @DisplayName("temperature outside 0..2 is rejected")
    void temperatureRange() {
        properties.setTemperature(2.5);
        assertThrows(ConfigurationException.class, properties::requireValid);
    }
}
