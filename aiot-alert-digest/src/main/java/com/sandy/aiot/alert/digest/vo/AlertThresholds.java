package com.sandy.aiot.alert.digest.vo;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Warning band per water parameter, keyed by lower-case parameter name.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AlertThresholds {
    private Map<String, Band> bands = new LinkedHashMap<>();

    public AlertThresholds with(String parameter, Double warningMin, Double warningMax) {
        bands.put(parameter.toLowerCase(Locale.ROOT), new Band(warningMin, warningMax));
        return this;
    }

    public Band bandFor(String parameter) {
        return parameter == null ? null : bands.get(parameter.toLowerCase(Locale.ROOT));
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Band {
        private Double warningMin;
        private Double warningMax;
    }
}
