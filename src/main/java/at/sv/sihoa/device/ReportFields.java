package at.sv.sihoa.device;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Lenient access to the fields of a device report. Missing, null or malformed values are returned as {@code null}.
 */
final class ReportFields {

    private ReportFields() {
    }

    static Integer readInteger(JsonNode report, String key) {
        JsonNode value = report.get(key);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isIntegralNumber()) {
            return value.asInt();
        }
        if (value.isNumber()) {
            return (int) Math.round(value.asDouble());
        }
        if (value.isTextual()) {
            try {
                return Integer.parseInt(value.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    static String readText(JsonNode report, String key) {
        JsonNode value = report.get(key);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }
}
