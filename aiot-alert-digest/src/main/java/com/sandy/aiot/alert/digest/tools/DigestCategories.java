package com.sandy.aiot.alert.digest.tools;

import java.util.Map;

/** Display labels for digest categories (email subject / body). */
public final class DigestCategories {
    private static final Map<String, String> LABELS = Map.of(
            "ph_high", "pH High",
            "ph_low", "pH Low",
            "tds_high", "TDS High",
            "tds_low", "TDS Low",
            "turbidity_high", "Turbidity High",
            "turbidity_low", "Turbidity Low",
            "trend_alert", "Trend Alert",
            "multi_param", "Multiple Parameters");

    private DigestCategories() {
    }

    public static String label(String category) {
        return LABELS.getOrDefault(category, category);
    }
}
