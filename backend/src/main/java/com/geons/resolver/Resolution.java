package com.geons.resolver;

import com.geons.domain.SliverTool;
import lombok.Getter;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Result of answering a lookup: the selected sliver tools (closest first where ordered) or why there are none.
 * Geo policies also report the client-to-selection distance, rounded up to whole km.
 */
@Getter
public class Resolution {

    private static final Resolution NOT_FOUND = new Resolution(ResolutionOutcome.NOT_FOUND, List.of(), null, null);

    private final ResolutionOutcome outcome;
    private final List<SliverTool> sliverTools;
    private final Long distanceKm;
    private final String reason;

    private Resolution(ResolutionOutcome outcome, List<SliverTool> sliverTools, Long distanceKm, String reason) {
        this.outcome = outcome;
        this.sliverTools = sliverTools;
        this.distanceKm = distanceKm;
        this.reason = reason;
    }

    public static Resolution found(List<SliverTool> sliverTools) {
        return found(sliverTools, null);
    }

    public static Resolution found(List<SliverTool> sliverTools, Long distanceKm) {
        if (sliverTools == null || sliverTools.isEmpty()) {
            return NOT_FOUND;
        }
        return new Resolution(ResolutionOutcome.FOUND, List.copyOf(sliverTools), distanceKm, null);
    }

    public static Resolution single(SliverTool sliverTool) {
        return found(List.of(sliverTool));
    }

    public static Resolution notFound() {
        return NOT_FOUND;
    }

    public static Resolution invalidQuery(String reason) {
        return new Resolution(ResolutionOutcome.INVALID_QUERY, List.of(), null, reason);
    }

    public boolean isFound() {
        return outcome == ResolutionOutcome.FOUND;
    }

    /** First (for ordered results, closest) selected tool. */
    public Optional<SliverTool> first() {
        return sliverTools.isEmpty() ? Optional.empty() : Optional.of(sliverTools.get(0));
    }

    public OptionalLong getDistanceKm() {
        return distanceKm == null ? OptionalLong.empty() : OptionalLong.of(distanceKm);
    }

    public Optional<String> getReason() {
        return Optional.ofNullable(reason);
    }
}
