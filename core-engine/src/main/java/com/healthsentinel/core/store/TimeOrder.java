package com.healthsentinel.core.store;

/**
 * Ordering of metric records returned by a range query.
 */
public enum TimeOrder {

    /** Ascending timestamps, used for history. */
    OLDEST_FIRST,

    /** Descending timestamps, used for detection windows. */
    NEWEST_FIRST
}
