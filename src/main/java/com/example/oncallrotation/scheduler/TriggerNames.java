package com.example.oncallrotation.scheduler;

import java.util.OptionalLong;

/**
 * Trigger names are the configured prefix followed by the epoch second they fire at.
 */
public final class TriggerNames {

    private TriggerNames() {
    }

    public static String nameOf(String prefix, long epochSecond) {
        return prefix + epochSecond;
    }

    /**
     * @return empty for names outside the prefix or without a numeric suffix
     */
    public static OptionalLong parseTimestamp(String prefix, String name) {
        if (name == null || !name.startsWith(prefix) || name.length() == prefix.length()) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(name.substring(prefix.length())));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }
}
