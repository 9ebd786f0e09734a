package com.evently.service.core.convert;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class EventTypeMatcherTest {

    @Test
    void singleInclusion() {
        EventTypeMatcher m = EventTypeMatcher.of("test.thing");
        assertThat(m.includedTypes()).containsExactly("test.thing");
        assertThat(m.excludedTypes()).isEmpty();
        assertThat(m.includes("test.thing")).isTrue();
        assertThat(m.excludes("test.thing")).isFalse();
        assertThat(m.matches("test.thing")).isTrue();
        assertThat(m.matches("random.thing")).isFalse();
    }

    @Test
    void inclusionList() {
        EventTypeMatcher m = EventTypeMatcher.of(List.of("test.thing", "other.thing"));
        assertThat(m.matches("test.thing")).isTrue();
        assertThat(m.matches("other.thing")).isTrue();
        assertThat(m.matches("random.thing")).isFalse();
    }

    @Test
    void exclusionOnlyWidensToEverythingElse() {
        EventTypeMatcher m = EventTypeMatcher.of("!test.thing");
        assertThat(m.includedTypes()).containsExactly("*");
        assertThat(m.excludedTypes()).containsExactly("test.thing");
        assertThat(m.excludes("test.thing")).isTrue();
        assertThat(m.includes("random.thing")).isTrue();
        assertThat(m.matches("test.thing")).isFalse();
        assertThat(m.matches("random.thing")).isTrue();

        EventTypeMatcher two = EventTypeMatcher.of("!test.thing", "!other.thing");
        assertThat(two.includedTypes()).hasSize(1);
        assertThat(two.excludedTypes()).hasSize(2);
        assertThat(two.matches("test.thing")).isFalse();
        assertThat(two.matches("other.thing")).isFalse();
        assertThat(two.matches("random.thing")).isTrue();
    }

    @Test
    void mixedInclusionsAndExclusions() {
        EventTypeMatcher m = EventTypeMatcher.of("*.thing", "!test.thing", "!other.thing");
        assertThat(m.includedTypes()).hasSize(1);
        assertThat(m.excludedTypes()).hasSize(2);
        assertThat(m.matches("test.thing")).isFalse();
        assertThat(m.matches("other.thing")).isFalse();
        assertThat(m.matches("random.whatzit")).isFalse();
        assertThat(m.matches("random.thing")).isTrue();
    }

    @Test
    void globSemantics() {
        EventTypeMatcher instance = EventTypeMatcher.of("compute.instance.*");
        assertThat(instance.matches("compute.instance.create.start")).isTrue();
        assertThat(instance.matches("image.upload")).isFalse();

        assertThat(EventTypeMatcher.of("*.start").matches("compute.instance.create.start")).isTrue();

        EventTypeMatcher notImage = EventTypeMatcher.of("!image.*");
        assertThat(notImage.matches("image.upload")).isFalse();
        assertThat(notImage.matches("compute.instance.exists")).isTrue();

        EventTypeMatcher single = EventTypeMatcher.of("image.?pdate");
        assertThat(single.matches("image.update")).isTrue();
        assertThat(single.matches("image.uupdate")).isFalse();
    }

    @Test
    void startEndButNotScheduler() {
        EventTypeMatcher m = EventTypeMatcher.of("*.start", "*.end", "!scheduler.*");
        assertThat(m.matches("compute.instance.create.start")).isTrue();
        assertThat(m.matches("image.delete.end")).isTrue();
        assertThat(m.matches("compute.instance.exists")).isFalse();
        assertThat(m.matches("scheduler.run_instance.start")).isFalse();
    }

    @Test
    void regexCharactersAreLiteral() {
        EventTypeMatcher m = EventTypeMatcher.of("compute.instance");
        assertThat(m.matches("compute.instance")).isTrue();
        assertThat(m.matches("computeXinstance")).isFalse();
        assertThat(EventTypeMatcher.of("a+b(c)").matches("a+b(c)")).isTrue();
        assertThat(EventTypeMatcher.of("a+b").matches("aab")).isFalse();
    }

    @Test
    void catchAll() {
        assertThat(EventTypeMatcher.of("*.thing", "!test.thing", "!other.thing").isCatchAll())
                .isFalse();
        assertThat(EventTypeMatcher.of("!other.thing").isCatchAll()).isFalse();
        assertThat(EventTypeMatcher.of("!image.*").isCatchAll()).isFalse();
        assertThat(EventTypeMatcher.of("other.thing").isCatchAll()).isFalse();
        assertThat(EventTypeMatcher.of("*", "!other.thing").isCatchAll()).isFalse();
        assertThat(EventTypeMatcher.of("*").isCatchAll()).isTrue();
        assertThat(EventTypeMatcher.of("*", "foo").isCatchAll()).isTrue();
    }

    @Test
    void emptyPatternListMatchesNothing() {
        EventTypeMatcher m = EventTypeMatcher.of(List.of());
        assertThat(m.matches("anything")).isFalse();
        assertThat(m.isCatchAll()).isFalse();
    }
}
