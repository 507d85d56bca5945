package com.geons.resolver;

import com.geons.domain.SliverTool;
import com.geons.domain.ToolStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RandomResolverTest {

    @Test
    @DisplayName("returns the candidate picked by the random source")
    void picksByRandomSource() {
        SliverTool a = SliverTools.tool("a", "lga01", 40.7, -73.9);
        SliverTool b = SliverTools.tool("b", "lhr01", 51.5, -0.4);
        ScriptedRandomSource random = new ScriptedRandomSource(1);
        RandomResolver resolver = new RandomResolver(new SliverTools.InMemoryCandidateProvider(List.of(a, b)), random);

        Resolution r = resolver.answerQuery(SliverTools.query());

        assertThat(r.isFound()).isTrue();
        assertThat(r.getSliverTools()).containsExactly(b);
        assertThat(r.getDistanceKm()).isEmpty();
        assertThat(random.bounds()).containsExactly(2);
    }

    @Test
    @DisplayName("no online candidate in either family is NOT_FOUND")
    void nothingOnlineIsNotFound() {
        SliverTool offline = SliverTools.tool("a", "lga01", 40.7, -73.9);
        offline.setStatusIpv4(ToolStatus.OFFLINE);
        offline.setStatusIpv6(ToolStatus.UNKNOWN);
        RandomResolver resolver = new RandomResolver(
                new SliverTools.InMemoryCandidateProvider(List.of(offline)), new ScriptedRandomSource());

        Resolution r = resolver.answerQuery(SliverTools.query());

        assertThat(r.getOutcome()).isEqualTo(ResolutionOutcome.NOT_FOUND);
        assertThat(r.getSliverTools()).isEmpty();
        assertThat(r.first()).isEmpty();
    }
}
