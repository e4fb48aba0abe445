/*
 * P3IF — Pattern Integration Framework
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.p3if.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The three fixed dimensions of the framework. Each relationship has exactly one slot per type.
 */
public enum PatternType {
    PROPERTY("property"),
    PROCESS("process"),
    PERSPECTIVE("perspective");

    private final String key;

    PatternType(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    @JsonCreator
    public static PatternType fromKey(String key) {
        if (key == null) throw new IllegalArgumentException("Pattern type must not be null");
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (PatternType type : values()) {
            if (type.key.equals(normalized)) return type;
        }
        throw new IllegalArgumentException("Unknown pattern type: " + key);
    }
}
