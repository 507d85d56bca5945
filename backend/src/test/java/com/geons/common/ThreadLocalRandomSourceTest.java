package com.geons.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThreadLocalRandomSourceTest {

    private final RandomSource random = new ThreadLocalRandomSource();

    @Test
    @DisplayName("indexes stay within bound and cover every slot")
    void indexesWithinBound() {
        Set<Integer> seen = new HashSet<>();
        for (int i = 0; i < 2_000; i++) {
            int index = random.nextIndex(3);
            assertThat(index).isBetween(0, 2);
            seen.add(index);
        }
        assertThat(seen).containsExactlyInAnyOrder(0, 1, 2);
    }

    @Test
    @DisplayName("choose returns an element of the list")
    void chooseReturnsElement() {
        assertThat(random.choose(List.of("a", "b"))).isIn("a", "b");
        assertThat(random.choose(List.of("only"))).isEqualTo("only");
    }

    @Test
    @DisplayName("choose rejects an empty list")
    void chooseRejectsEmpty() {
        assertThatThrownBy(() -> random.choose(List.of())).isInstanceOf(IllegalArgumentException.class);
    }
}
