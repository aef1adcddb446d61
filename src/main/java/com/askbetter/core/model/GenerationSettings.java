package com.askbetter.core.model;

import java.io.Serializable;

/**
 * Per-request generation controls. {@code seed} may be null when the service should
 * pick one.
 */
public record GenerationSettings(String model, double temperature, Integer seed) implements Serializable {

    public GenerationSettings {
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("model must not be blank");
        }
        if (temperature < 0.0 || temperature > 2.0) {
            throw new IllegalArgumentException("temperature must be within [0, 2]: " + temperature);
        }
    }

    public GenerationSettings withModel(String override) {
        return override == null || override.isBlank() ? this : new GenerationSettings(override, temperature, seed);
    }

    public GenerationSettings withTemperature(Double override) {
        return override == null ? this : new GenerationSettings(model, override, seed);
    }

    public GenerationSettings withSeed(Integer override) {
        return override == null ? this : new GenerationSettings(model, temperature, override);
    }
}
