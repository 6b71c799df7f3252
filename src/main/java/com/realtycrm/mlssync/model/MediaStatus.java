package com.realtycrm.mlssync.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Processing state of a {@link PropertyMedia} row. Forward progress is ordered by {@code rank};
 * {@code FAILED} sits outside the ordering and can be left for any state through a retry.
 */
@Getter
@AllArgsConstructor
public enum MediaStatus {
    PENDING(0),
    DOWNLOADED(1),
    PROCESSED(2),
    UPLOADED(3),
    FAILED(-1);

    private final int rank;

    /**
     * A transition is allowed when it moves forward, when it records a failure of a row that has not been
     * uploaded, or when it leaves {@code FAILED}.
     */
    public boolean canAdvanceTo(MediaStatus next) {
        if (this == FAILED) {
            return next != FAILED;
        }
        if (next == FAILED) {
            return this != UPLOADED;
        }
        return next.rank > this.rank;
    }
}
