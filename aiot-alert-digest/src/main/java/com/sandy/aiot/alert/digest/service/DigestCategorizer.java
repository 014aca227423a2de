package com.sandy.aiot.alert.digest.service;

import com.sandy.aiot.alert.digest.entity.DigestPolicy;
import com.sandy.aiot.alert.digest.vo.AlertThresholds;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;

/**
 * Maps a raw alert to the category that forms part of its digest key.
 * Pure and total: anything it cannot place goes to {@link DigestPolicy#FALLBACK_CATEGORY}.
 */
@Component
@RequiredArgsConstructor
public class DigestCategorizer {

    private static final Set<String> BANDED_PARAMETERS = Set.of("ph", "tds", "turbidity");

    private final AlertThresholds configuredThresholds;

    public String categorize(String parameter, Double value) {
        return categorize(parameter, value, configuredThresholds);
    }

    public static String categorize(String parameter, Double value, AlertThresholds thresholds) {
        if (parameter == null || value == null || value.isNaN() || thresholds == null) {
            return DigestPolicy.FALLBACK_CATEGORY;
        }
        String p = parameter.trim().toLowerCase(Locale.ROOT);
        if (!BANDED_PARAMETERS.contains(p)) return DigestPolicy.FALLBACK_CATEGORY;
        AlertThresholds.Band band = thresholds.bandFor(p);
        if (band == null) return DigestPolicy.FALLBACK_CATEGORY;
        if (band.getWarningMax() != null && value > band.getWarningMax()) return p + "_high";
        if (band.getWarningMin() != null && value < band.getWarningMin()) return p + "_low";
        return DigestPolicy.FALLBACK_CATEGORY;
    }
}
