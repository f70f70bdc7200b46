package com.agrigrid.core.model;

/**
 * Shared weather conditions. The planner and the watering worker only read
 * {@code temperature} and {@code rainForecast24h}.
 *
 * @param temperature     degrees Celsius
 * @param humidity        percent
 * @param rainForecast24h rain expected within the next day
 * @param windSpeed       km/h
 */
public record WeatherState(
    double temperature,
    double humidity,
    boolean rainForecast24h,
    double windSpeed
) {

    public static final double HEAT_STRESS_TEMPERATURE = 32.0;

    public static WeatherState defaults() {
        return new WeatherState(25.0, 60.0, false, 10.0);
    }

    public boolean heatStress() {
        return temperature > HEAT_STRESS_TEMPERATURE;
    }
}
