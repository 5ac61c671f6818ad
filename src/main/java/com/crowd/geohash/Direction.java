package com.crowd.geohash;

/**
 * Cardinal directions for neighbor lookups
 */
public enum Direction {
    NORTH,
    SOUTH,
    EAST,
    WEST
}
