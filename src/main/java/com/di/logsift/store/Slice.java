package com.di.logsift.store;

/**
 * One of {@code max} deterministic, store-side partitions of a scan.
 */
public record Slice(int id, int max) {

    public Slice {
        if (max < 2) {
            throw new IllegalArgumentException("slice max must be at least 2, got " + max);
        }
        if (id < 0 || id >= max) {
            throw new IllegalArgumentException("slice id must be in [0, " + max + "), got " + id);
        }
    }

    @Override
    public String toString() {
        return id + "/" + max;
    }
}
