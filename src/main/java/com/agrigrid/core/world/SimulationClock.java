package com.agrigrid.core.world;

/**
 * Discrete simulation time. One tick is the only unit of time in the loop.
 */
public class SimulationClock {

    private long tick;

    public long current() {
        return tick;
    }

    public long advance() {
        return ++tick;
    }
}
