package com.geons.resolver;

import com.geons.common.GeoDistance;
import com.geons.common.RandomSource;
import com.geons.domain.Policy;
import com.geons.domain.SliverTool;
import com.geons.lookup.CandidateProvider;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Chooses the sliver tool geographically closest to the client. Ties at the minimum distance are broken at random.
 */
@Slf4j
public class GeoResolver extends AbstractResolver {

    public GeoResolver(CandidateProvider candidateProvider, RandomSource randomSource) {
        super(candidateProvider, randomSource);
    }

    @Override
    public Policy policy() {
        return Policy.GEO;
    }

    @Override
    protected Resolution select(LookupQuery query) {
        List<SliverTool> candidates = getCandidates(query);
        if (candidates.isEmpty()) {
            return notFound(query);
        }
        if (!query.hasCoordinates()) {
            log.warn("No geolocation info for {}, returning a random sliver tool", query.getToolId());
            return pickOne(candidates);
        }
        log.info("Found {} candidates for {}", candidates.size(), query.getToolId());

        double minDistance = Double.POSITIVE_INFINITY;
        List<SliverTool> closest = new ArrayList<>();
        Map<String, Double> distanceBySite = new HashMap<>();
        for (SliverTool tool : candidates) {
            double distance = distanceBySite.computeIfAbsent(tool.getSiteId(),
                    site -> GeoDistance.distanceKm(query.getLatitude(), query.getLongitude(),
                            tool.getLatitude(), tool.getLongitude()));
            if (distance < minDistance) {
                minDistance = distance;
                closest.clear();
                closest.add(tool);
            } else if (distance == minDistance) {
                closest.add(tool);
            }
        }
        return Resolution.found(List.of(randomSource.choose(closest)), (long) Math.ceil(minDistance));
    }
}
