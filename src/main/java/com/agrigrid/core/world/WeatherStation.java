package com.agrigrid.core.world;

import com.agrigrid.core.model.WeatherState;

import java.util.Random;

/**
 * Holds the shared weather and perturbs it with a seeded random walk.
 */
public class WeatherStation {

    private final Random random;
    private final double rainProbability;
    private WeatherState current = WeatherState.defaults();

    public WeatherStation(Random random, double rainProbability) {
        this.random = random;
        this.rainProbability = rainProbability;
    }

    public WeatherState current() {
        return current;
    }

    public void set(WeatherState weather) {
        this.current = weather;
    }

    /**
     * Temperature drifts by up to 2 degrees within [20, 35], humidity by up to 5 within
     * [40, 90], wind by up to 3 within [5, 40]; rain is forecast with the configured probability.
     */
    public WeatherState update() {
        double temperature = clamp(current.temperature() + uniform(-2, 2), 20, 35);
        double humidity = clamp(current.humidity() + uniform(-5, 5), 40, 90);
        boolean rain = random.nextDouble() < rainProbability;
        double wind = clamp(current.windSpeed() + uniform(-3, 3), 5, 40);
        current = new WeatherState(temperature, humidity, rain, wind);
        return current;
    }

    private double uniform(double min, double max) {
        return min + (max - min) * random.nextDouble();
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
