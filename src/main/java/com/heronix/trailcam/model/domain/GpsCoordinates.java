package com.heronix.trailcam.model.domain;

import java.util.Locale;

public record GpsCoordinates(double latitude, double longitude) {

    /**
     * Render as "lat, lon" with five decimals.
     */
    public String format() {
        return String.format(Locale.ROOT, "%.5f, %.5f", latitude, longitude);
    }
}
