package com.geons.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * IP address family a lookup is answered for. Candidates are filtered by their status in this family.
 */
public enum AddressFamily {
    IPV4("statusIpv4"),
    IPV6("statusIpv6");

    private final String statusField;

    AddressFamily(String statusField) {
        this.statusField = statusField;
    }

    /** Name of the sliver_tools document field holding the status for this family. */
    public String statusField() {
        return statusField;
    }

    public AddressFamily other() {
        return this == IPV4 ? IPV6 : IPV4;
    }

    public ToolStatus statusOf(SliverTool tool) {
        return this == IPV4 ? tool.getStatusIpv4() : tool.getStatusIpv6();
    }

    public boolean isOnline(SliverTool tool) {
        return statusOf(tool) == ToolStatus.ONLINE;
    }

    /**
     * Parses "ipv4" / "ipv6" (any case). Empty for null, blank or unknown values.
     */
    public static Optional<AddressFamily> fromString(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return switch (value.strip().toLowerCase(Locale.ROOT)) {
            case "ipv4" -> Optional.of(IPV4);
            case "ipv6" -> Optional.of(IPV6);
            default -> Optional.empty();
        };
    }
}
