package com.mogu.ranking.history;

public enum SignalType {
    STRONG(2.0),
    MEDIUM(0.5),
    WEAK(1.0);

    private final double weight;

    SignalType(double weight) {
        this.weight = weight;
    }

    public double weight() {
        return weight;
    }
}
