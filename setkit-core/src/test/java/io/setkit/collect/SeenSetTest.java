package io.setkit.collect;

import io.setkit.core.SetkitConfiguration;
import io.setkit.core.SetkitConfiguration.DedupStrategy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SeenSetTest {

    @Test
    void shouldStartEmpty() {
        var seen = new SeenSet<String>();

        assertThat(seen.isEmpty()).isTrue();
        assertThat(seen.size()).isZero();
        assertThat(seen.has("a")).isFalse();
    }

    @Test
    void seeReturnsTrueOnlyOnce() {
        var seen = new SeenSet<String>();

        assertThat(seen.see("a")).isTrue();
        assertThat(seen.see("b")).isTrue();
        assertThat(seen.see("a")).isFalse();
        assertThat(seen.size()).isEqualTo(2);
    }

    @Test
    void resetAllowsSeeingAgain() {
        var seen = new SeenSet<String>();
        seen.see("a");

        seen.reset();

        assertThat(seen.isEmpty()).isTrue();
        assertThat(seen.has("a")).isFalse();
        assertThat(seen.see("a")).isTrue();
    }

    @Test
    void setSeenMarksValue() {
        var seen = new SeenSet<Integer>();

        seen.setSeen(4);
        seen.setSeen(4);

        assertThat(seen.has(4)).isTrue();
        assertThat(seen.size()).isEqualTo(1);
        assertThat(seen.see(4)).isFalse();
    }

    @Test
    void seeAllCountsNewValues() {
        var seen = new SeenSet<Integer>();
        seen.see(1);

        assertThat(seen.seeAll(Arrays.asList(1, 2, null, 2, 3))).isEqualTo(2);
        assertThat(seen.seeAll(null)).isZero();
        assertThat(seen.size()).isEqualTo(3);
    }

    @Test
    void shouldRejectNullSee() {
        var seen = new SeenSet<String>();

        assertThatThrownBy(() -> seen.see(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> seen.setSeen(null)).isInstanceOf(IllegalArgumentException.class);
        assertThat(seen.has(null)).isFalse();
    }

    @ParameterizedTest(name = "filters with {0}")
    @EnumSource(DedupStrategy.class)
    void filtersSplitSeenAndUnseen(DedupStrategy strategy) {
        var seen = new SeenSet<String>(SetkitConfiguration.builder().dedupStrategy(strategy).build());
        seen.see("a");
        seen.see("b");
        var input = List.of("a", "b", "c", "a");

        assertThat(seen.filterSeen(input)).containsExactly("a", "b");
        assertThat(seen.filterNotSeen(input)).containsExactly("c");
        assertThat(input).containsExactly("a", "b", "c", "a");
    }

    @ParameterizedTest(name = "order preserved with {0}")
    @EnumSource(DedupStrategy.class)
    void filtersPreserveFirstOccurrenceOrder(DedupStrategy strategy) {
        var seen = new SeenSet<Integer>(SetkitConfiguration.builder().dedupStrategy(strategy).build());
        seen.seeAll(List.of(2, 4, 6));

        var input = List.of(6, 1, 2, 1, 6, 3, 4, 3);

        assertThat(seen.filterSeen(input)).containsExactly(6, 2, 4);
        assertThat(seen.filterNotSeen(input)).containsExactly(1, 3);
    }

    @Test
    void filtersHandleEmptyAndNullInput() {
        var seen = new SeenSet<String>();
        seen.see("a");

        assertThat(seen.filterSeen(List.of())).isEmpty();
        assertThat(seen.filterNotSeen(null)).isEmpty();
    }

    @Test
    void filterResultIsIndependent() {
        var seen = new SeenSet<String>();
        seen.see("a");

        var result = seen.filterSeen(List.of("a"));
        result.add("z");

        assertThat(seen.has("z")).isFalse();
    }

    @Test
    void nullEntriesAreNeverSeen() {
        var seen = new SeenSet<String>();
        seen.see("a");

        var input = Arrays.asList("a", null, "b", null);

        assertThat(seen.filterSeen(input)).containsExactly("a");
        assertThat(seen.filterNotSeen(input)).containsExactly(null, "b");
    }

    @Test
    void filtersPartitionDistinctValues() {
        var random = new Random(3);
        var seen = new SeenSet<Integer>();
        for (var round = 0; round < 100; round++) {
            if (random.nextBoolean()) {
                seen.see(random.nextInt(20));
            }
            var input = new ArrayList<Integer>();
            var length = random.nextInt(30);
            for (var i = 0; i < length; i++) {
                input.add(random.nextInt(20));
            }

            var seenPart = seen.filterSeen(input);
            var unseenPart = seen.filterNotSeen(input);

            var union = new HashSet<Integer>(seenPart);
            union.addAll(unseenPart);
            assertThat(union).isEqualTo(new HashSet<>(input));
            assertThat(seenPart).doesNotHaveDuplicates().allMatch(seen::has);
            assertThat(unseenPart).doesNotHaveDuplicates().noneMatch(seen::has);

            var order = new ArrayList<>(new LinkedHashSet<>(input));
            order.retainAll(seenPart);
            assertThat(seenPart).containsExactlyElementsOf(order);
        }
    }
}
