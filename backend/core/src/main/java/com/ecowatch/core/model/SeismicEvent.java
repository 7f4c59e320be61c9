package com.ecowatch.core.model;

import java.time.Instant;

/**
 * @param magnitude one decimal place, {@code null} when the feed had no usable value
 * @param timestamp {@code null} when the date/time cells could not be parsed
 */
public record SeismicEvent(String location, Double magnitude, Instant timestamp) {
}
