package io.toolfence.core.parse;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Random;
import org.junit.jupiter.api.Test;

class ToolCallIdGeneratorTest {

    @Test
    void shouldCombineEpochMillisWithBase36Suffix() {
        Clock clock = Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC);
        ToolCallIdGenerator generator = new ToolCallIdGenerator(clock, () -> new Random(7));

        String id = generator.get();

        assertThat(id).matches("call_1700000000000_[0-9a-z]{7}");
        assertThat(generator.get()).isEqualTo(id);
    }

    @Test
    void shouldVaryWithDefaultRandomSource() {
        ToolCallIdGenerator generator = new ToolCallIdGenerator();

        assertThat(generator.get()).startsWith("call_").isNotEqualTo(generator.get());
    }
}
