package io.toolfence.core.parse;

import java.time.Clock;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Produces ids of the form {@code call_<epochMillis>_<7 base-36 chars>} for calls the model did
 * not label.
 */
public final class ToolCallIdGenerator implements Supplier<String> {
    private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int SUFFIX_LENGTH = 7;

    private final Clock clock;
    private final Supplier<Random> random;

    public ToolCallIdGenerator() {
        this(Clock.systemUTC(), ThreadLocalRandom::current);
    }

    public ToolCallIdGenerator(Clock clock, Supplier<Random> random) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    @Override
    public String get() {
        Random source = random.get();
        StringBuilder suffix = new StringBuilder(SUFFIX_LENGTH);
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            suffix.append(ALPHABET.charAt(source.nextInt(ALPHABET.length())));
        }
        return "call_" + clock.millis() + "_" + suffix;
    }
}
