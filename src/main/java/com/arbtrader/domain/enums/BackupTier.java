package com.arbtrader.domain.enums;

/** Retention tiers of the tiered backup manager, finest first. The path segment is part of each backup key. */
public enum BackupTier {
    MINUTE("minute"),
    HOUR("hour"),
    DAILY("daily");

    private final String pathSegment;

    BackupTier(String pathSegment) {
        this.pathSegment = pathSegment;
    }

    public String getPathSegment() {
        return pathSegment;
    }
}
