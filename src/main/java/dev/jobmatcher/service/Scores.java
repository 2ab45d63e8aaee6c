package dev.jobmatcher.service;

final class Scores {

    private Scores() {
    }

    /**
     * Round half up to 2 decimals.
     */
    static double round2(double value) {
        return Math.round(value * 100) / 100.0;
    }

    static double cap100(double value) {
        return Math.min(value, 100);
    }
}
