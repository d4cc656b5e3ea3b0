package com.lidar.model;

/**
 * Lifecycle of a cached source tile row
 */
public enum CacheState {
    DOWNLOADING,
    COMPLETE,
    FAILED
}
