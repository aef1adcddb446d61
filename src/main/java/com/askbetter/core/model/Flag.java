package com.askbetter.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Known flag vocabulary. Declaration order is the priority order: PII tags
 * come first so consumers can treat the head of the flag list as safety-critical.
 */
public enum Flag {

    EMAIL("email", Category.PII),
    PHONE("phone", Category.PII),
    CARD_ISH("card-ish", Category.PII),
    VAGUE("vague", Category.ADVISORY),
    UNSAFE("unsafe", Category.ADVISORY);

    public enum Category { PII, ADVISORY }

    private final String tag;
    private final Category category;

    Flag(String tag, Category category) {
        this.tag = tag;
        this.category = category;
    }

    public String tag() {
        return tag;
    }

    public Category category() {
        return category;
    }

    /**
     * Resolves a tag case-insensitively, ignoring surrounding whitespace.
     */
    public static Optional<Flag> fromTag(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.strip().toLowerCase(Locale.ROOT);
        for (Flag flag : values()) {
            if (flag.tag.equals(normalized)) {
                return Optional.of(flag);
            }
        }
        return Optional.empty();
    }
}
