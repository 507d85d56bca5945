package com.geons.domain;

/**
 * Per-address-family liveness of a sliver tool, as last reported by the registration process.
 */
public enum ToolStatus {
    ONLINE,
    OFFLINE,
    UNKNOWN
}
