package com.citation.ris.util;

import java.util.LinkedHashMap;
import java.util.Map;

import com.citation.ris.exception.ConfigurationException;

/**
 * Helpers for tag tables.
 */
public class MappingUtil {

    private MappingUtil() {
        // Utility class
    }

    /**
     * Swaps keys and values, keeping iteration order.
     *
     * @throws ConfigurationException if a value occurs more than once
     */
    public static <K, V> Map<V, K> invert(Map<K, V> mapping) {
        Map<V, K> inverted = new LinkedHashMap<>();
        for (Map.Entry<K, V> entry : mapping.entrySet()) {
            K previous = inverted.putIfAbsent(entry.getValue(), entry.getKey());
            if (previous != null) {
                throw new ConfigurationException("Mapping cannot be inverted; value '" + entry.getValue()
                        + "' is used by both " + previous + " and " + entry.getKey());
            }
        }
        return inverted;
    }
}
