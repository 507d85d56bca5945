package com.geons.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One addressable instance of a measurement tool hosted at a site. Written by the registration process;
 * read-only here. Several sliver tools may share a siteId.
 */
@Document(collection = "sliver_tools")
@CompoundIndexes({
        @CompoundIndex(name = "tool_status_ipv4", def = "{'toolId': 1, 'statusIpv4': 1, 'siteId': 1}"),
        @CompoundIndex(name = "tool_status_ipv6", def = "{'toolId': 1, 'statusIpv6': 1, 'siteId': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
@ToString(onlyExplicitlyIncluded = true)
public class SliverTool {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @ToString.Include
    private String toolId;
    private String sliceId;
    private String serverId;
    @ToString.Include
    private String siteId;
    @ToString.Include
    private String fqdn;
    private String serverPort;
    private String httpPort;
    private String sliverIpv4;
    private String sliverIpv6;
    private ToolStatus statusIpv4 = ToolStatus.UNKNOWN;
    private ToolStatus statusIpv6 = ToolStatus.UNKNOWN;
    private String country;
    private String city;
    private double latitude;
    private double longitude;
    private Instant updateRequestTimestamp;
}
