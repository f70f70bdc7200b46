package com.agrigrid.core.scheduler;

/**
 * A depletable pool. Consumption only ever lowers {@code available}; pools are refilled by
 * building a new one.
 */
public final class Resource {

    private final ResourceType type;
    private final double capacity;
    private double available;

    public Resource(ResourceType type, double capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("Resource capacity must not be negative: " + type + "=" + capacity);
        }
        this.type = type;
        this.capacity = capacity;
        this.available = capacity;
    }

    /**
     * False for negative amounts; a draw never refills a pool.
     */
    public boolean canSupply(double amount) {
        return amount >= 0 && amount <= available;
    }

    void consume(double amount) {
        if (amount < 0) {
            throw new IllegalArgumentException(type + " draw must not be negative: " + amount);
        }
        if (!canSupply(amount)) {
            throw new IllegalStateException(type + " pool exhausted: need " + amount + ", have " + available);
        }
        available -= amount;
    }

    public double utilisation() {
        return capacity == 0 ? 0.0 : (capacity - available) / capacity;
    }

    public ResourceType type() { return type; }
    public double capacity() { return capacity; }
    public double available() { return available; }
}
