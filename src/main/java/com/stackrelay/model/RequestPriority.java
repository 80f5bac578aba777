package com.stackrelay.model;

/**
 * Dispatch priority. Higher bands are always served first; within a band requests are served in enqueue order.
 */
public enum RequestPriority {
    LOW,
    NORMAL,
    HIGH,
    URGENT
}
