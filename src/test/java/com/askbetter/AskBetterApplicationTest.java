package com.askbetter;

import com.askbetter.core.error.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.BeanCreationException;

import static org.junit.jupiter.api.Assertions.*;

class AskBetterApplicationTest {

    @Test
    @DisplayName("finds a configuration error wrapped by context startup")
    void findsWrappedConfigurationError() {
        var config = new ConfigurationException("OPENAI_API_KEY is not set");
        var startup = new BeanCreationException("openAiChatModel", "Failed to instantiate",
                new IllegalStateException("factory method failed", config));

        assertSame(config, AskBetterApplication.configurationFailure(startup));
    }

    @Test
    @DisplayName("returns null for other startup failures")
    void ignoresOtherFailures() {
        assertNull(AskBetterApplication.configurationFailure(new IllegalStateException("port in use")));
    }
}
