package com.architecture.dataops.modelplan.service.simulation;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Directional matrix of safe column type changes.
 * Any pair not listed is treated as breaking.
 */
public final class TypeCompatibility {

    private static final Map<String, Set<String>> SAFE_WIDENINGS = Map.of(
            "INT", Set.of("BIGINT", "FLOAT", "DOUBLE"),
            "BIGINT", Set.of("DOUBLE"),
            "FLOAT", Set.of("DOUBLE"),
            "SMALLINT", Set.of("INT", "BIGINT"),
            "TINYINT", Set.of("INT", "BIGINT"),
            "VARCHAR", Set.of("STRING"),
            "CHAR", Set.of("STRING", "VARCHAR"),
            "DATE", Set.of("TIMESTAMP"));

    private TypeCompatibility() {
    }

    /**
     * Whether changing a column from {@code oldType} to {@code newType} keeps existing readers working.
     * Case and surrounding whitespace are ignored.
     */
    public static boolean isCompatible(String oldType, String newType) {
        if (oldType == null || newType == null) {
            return false;
        }
        String from = normalize(oldType);
        String to = normalize(newType);
        if (from.equals(to)) {
            return true;
        }
        return SAFE_WIDENINGS.getOrDefault(from, Set.of()).contains(to);
    }

    private static String normalize(String type) {
        return type.trim().toUpperCase(Locale.ROOT);
    }
}
