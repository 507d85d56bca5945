package com.geons.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AddressFamilyTest {

    @Test
    @DisplayName("other() swaps IPv4 and IPv6")
    void otherSwaps() {
        assertThat(AddressFamily.IPV4.other()).isEqualTo(AddressFamily.IPV6);
        assertThat(AddressFamily.IPV6.other()).isEqualTo(AddressFamily.IPV4);
    }

    @Test
    @DisplayName("status is read from the field of the matching family")
    void statusPerFamily() {
        SliverTool tool = new SliverTool();
        tool.setStatusIpv4(ToolStatus.ONLINE);
        tool.setStatusIpv6(ToolStatus.OFFLINE);

        assertThat(AddressFamily.IPV4.isOnline(tool)).isTrue();
        assertThat(AddressFamily.IPV6.isOnline(tool)).isFalse();
        assertThat(AddressFamily.IPV4.statusField()).isEqualTo("statusIpv4");
        assertThat(AddressFamily.IPV6.statusField()).isEqualTo("statusIpv6");
    }

    @Test
    @DisplayName("new sliver tools start UNKNOWN in both families")
    void defaultStatusUnknown() {
        SliverTool tool = new SliverTool();
        assertThat(AddressFamily.IPV4.statusOf(tool)).isEqualTo(ToolStatus.UNKNOWN);
        assertThat(AddressFamily.IPV6.statusOf(tool)).isEqualTo(ToolStatus.UNKNOWN);
    }

    @Test
    @DisplayName("fromString accepts ipv4/ipv6 in any case")
    void fromString() {
        assertThat(AddressFamily.fromString("IPv6")).contains(AddressFamily.IPV6);
        assertThat(AddressFamily.fromString(" ipv4 ")).contains(AddressFamily.IPV4);
        assertThat(AddressFamily.fromString("ipx")).isEmpty();
        assertThat(AddressFamily.fromString(null)).isEmpty();
    }
}
