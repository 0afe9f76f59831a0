package com.pcoptimizer.licensing.model;

public record StorageStatus(
        boolean durable,
        boolean reachable,
        long totalLicenses,
        long activeLicenses
) {
    public static StorageStatus unreachable(boolean durable) {
        return new StorageStatus(durable, false, -1, -1);
    }
}
