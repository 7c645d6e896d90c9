package com.heronix.trailcam.model.domain;

/**
 * The account identifier and secret used to log in to the identity provider.
 */
public record Credential(String identifier, String secret) {

    @Override
    public String toString() {
        return "Credential[identifier=" + identifier + ", secret=****]";
    }
}
