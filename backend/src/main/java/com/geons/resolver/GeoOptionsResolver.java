package com.geons.resolver;

import com.geons.common.GeoDistance;
import com.geons.common.RandomSource;
import com.geons.domain.Policy;
import com.geons.domain.SliverTool;
import com.geons.lookup.CandidateProvider;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Returns up to {@value #MAX_OPTIONS} sliver tools at distinct sites, closest first. Each site contributes one
 * randomly chosen tool, so co-hosted slivers cannot crowd out other locations.
 */
@Slf4j
public class GeoOptionsResolver extends AbstractResolver {

    public static final int MAX_OPTIONS = 4;

    public GeoOptionsResolver(CandidateProvider candidateProvider, RandomSource randomSource) {
        super(candidateProvider, randomSource);
    }

    @Override
    public Policy policy() {
        return Policy.GEO_OPTIONS;
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

        Map<String, List<SliverTool>> bySite = new LinkedHashMap<>();
        for (SliverTool tool : candidates) {
            bySite.computeIfAbsent(tool.getSiteId(), k -> new ArrayList<>()).add(tool);
        }

        List<Ranked> ranked = new ArrayList<>(bySite.size());
        for (List<SliverTool> siteTools : bySite.values()) {
            SliverTool representative = randomSource.choose(siteTools);
            double distance = GeoDistance.distanceKm(query.getLatitude(), query.getLongitude(),
                    representative.getLatitude(), representative.getLongitude());
            ranked.add(new Ranked(representative, distance));
        }
        ranked.sort(Comparator.comparingDouble(Ranked::distanceKm));

        List<SliverTool> options = ranked.stream()
                .limit(MAX_OPTIONS)
                .map(Ranked::sliverTool)
                .toList();
        log.info("Returning {} of {} sites for {}", options.size(), bySite.size(), query.getToolId());
        return Resolution.found(options, (long) Math.ceil(ranked.get(0).distanceKm()));
    }

    private record Ranked(SliverTool sliverTool, double distanceKm) {}
}
