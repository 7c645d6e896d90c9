package com.heronix.trailcam.model.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Weather recorded by the vendor alongside the most recent photo.
 */
@Value
@Builder
public class WeatherSnapshot {

    Double temperature;

    /**
     * Vendor label such as "Clear" or "Light Rain"
     */
    String conditions;

    Double windSpeed;

    /**
     * Cardinal label, e.g. "NNW"
     */
    String windDirection;

    Double windGust;

    Double pressure;

    String pressureTendency;

    String moonPhase;

    String sunPhase;

    Double tempMin12h;

    Double tempMax12h;

    Double tempDeparture24h;
}
