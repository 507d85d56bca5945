package com.geons.resolver;

import com.geons.domain.AddressFamily;
import com.geons.domain.Policy;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * One client lookup: which tool, which policy, and the client context the policy may need.
 * Built per request by the request-handling layer and answered by exactly one resolver.
 */
@NoArgsConstructor
@Getter
@Setter
@ToString
public class LookupQuery {

    private String toolId;
    private Policy policy;
    /** Null when neither the client nor the server picked a family. */
    private AddressFamily addressFamily;
    /** True when the client explicitly asked for {@link #addressFamily}; disables family fallback. */
    private boolean userDefinedAddressFamily;
    private Double latitude;
    private Double longitude;
    private String metro;
    private String userDefinedCountry;

    public boolean hasCoordinates() {
        return latitude != null && longitude != null;
    }
}
