package com.heronix.trailcam.model.domain;

/**
 * Radio cell the camera last attached to, parsed from the comma separated
 * {@code servingCell} status string, e.g. {@code "FDD LTE,311480,LTE BAND 4,2350,-79,221,-15"}.
 *
 * @param rssiDbm   received signal strength, null when the string is short
 * @param rsrqDb    reference signal quality, null when the string is short
 */
public record ServingCell(
        String networkType,
        String operatorCode,
        String band,
        Integer frequencyMhz,
        Integer rssiDbm,
        Integer rsrpDbm,
        Integer rsrqDb
) {

    /**
     * Parse the status string.
     *
     * @return null unless at least network type, operator and band are present
     */
    public static ServingCell parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String[] parts = raw.split(",");
        if (parts.length < 3) {
            return null;
        }
        boolean full = parts.length >= 7;
        return new ServingCell(
                parts[0].trim(),
                parts[1].trim(),
                parts[2].trim(),
                full ? toInt(parts[3]) : null,
                full ? toInt(parts[4]) : null,
                full ? toInt(parts[5]) : null,
                full ? toInt(parts[6]) : null);
    }

    public String summary() {
        return networkType + " - " + band;
    }

    /**
     * Excellent from -70 dBm, Good from -85, Fair from -100, Poor below.
     */
    public String signalQuality() {
        if (rssiDbm == null) {
            return null;
        }
        if (rssiDbm >= -70) {
            return "Excellent";
        } else if (rssiDbm >= -85) {
            return "Good";
        } else if (rssiDbm >= -100) {
            return "Fair";
        }
        return "Poor";
    }

    private static Integer toInt(String value) {
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
