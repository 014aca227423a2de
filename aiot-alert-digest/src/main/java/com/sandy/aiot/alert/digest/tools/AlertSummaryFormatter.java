package com.sandy.aiot.alert.digest.tools;

import com.sandy.aiot.alert.digest.vo.RawAlertEvent;

import java.util.Locale;

/**
 * Short one-line description of a raw alert, e.g. "Critical: pH 9.20 at Tank-3".
 */
public final class AlertSummaryFormatter {

    private AlertSummaryFormatter() {
    }

    public static String summarize(RawAlertEvent event) {
        StringBuilder sb = new StringBuilder();
        sb.append(event.getSeverity()).append(": ").append(parameterName(event.getParameter()));
        if (event.getValue() != null) {
            sb.append(' ').append(String.format(Locale.ROOT, "%.2f", event.getValue())).append(unit(event.getParameter()));
        }
        if (event.getDeviceName() != null && !event.getDeviceName().isBlank()) {
            sb.append(" at ").append(event.getDeviceName());
        }
        return sb.toString();
    }

    static String parameterName(String parameter) {
        if (parameter == null) return "Unknown";
        switch (parameter.toLowerCase(Locale.ROOT)) {
            case "ph": return "pH";
            case "tds": return "TDS";
            case "turbidity": return "Turbidity";
            default: return parameter;
        }
    }

    static String unit(String parameter) {
        if (parameter == null) return "";
        switch (parameter.toLowerCase(Locale.ROOT)) {
            case "tds": return " ppm";
            case "turbidity": return " NTU";
            default: return "";
        }
    }
}
