package io.cronkit.cron;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Matches the values of a single cron field.
 */
public sealed interface FieldMatcher
        permits FieldMatcher.Wildcard, FieldMatcher.Single, FieldMatcher.Range,
        FieldMatcher.Stepped, FieldMatcher.AnyOf {

    boolean matches(int value);

    /**
     * Renders the matcher back to cron syntax.
     */
    String format();

    default boolean isWildcard() {
        return false;
    }

    /** {@code *} */
    record Wildcard() implements FieldMatcher {
        @Override
        public boolean matches(int value) {
            return true;
        }

        @Override
        public String format() {
            return "*";
        }

        @Override
        public boolean isWildcard() {
            return true;
        }
    }

    /** A single value, e.g. {@code 5}. */
    record Single(int value) implements FieldMatcher {
        @Override
        public boolean matches(int value) {
            return this.value == value;
        }

        @Override
        public String format() {
            return Integer.toString(value);
        }
    }

    /** Inclusive range, e.g. {@code 1-5}. */
    record Range(int from, int to) implements FieldMatcher {
        @Override
        public boolean matches(int value) {
            return value >= from && value <= to;
        }

        @Override
        public String format() {
            return from + "-" + to;
        }
    }

    /**
     * Every {@code step}-th value from {@code from} up to {@code to}: {@code *}/N, A-B/N or A/N.
     */
    record Stepped(int from, int to, int step, boolean overWildcard) implements FieldMatcher {
        @Override
        public boolean matches(int value) {
            return value >= from && value <= to && (value - from) % step == 0;
        }

        @Override
        public String format() {
            return (overWildcard ? "*" : from + "-" + to) + "/" + step;
        }
    }

    /** Comma separated list; matches when any element matches. */
    record AnyOf(List<FieldMatcher> elements) implements FieldMatcher {
        public AnyOf {
            elements = List.copyOf(elements);
        }

        @Override
        public boolean matches(int value) {
            for (FieldMatcher element : elements) {
                if (element.matches(value)) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public String format() {
            return elements.stream().map(FieldMatcher::format).collect(Collectors.joining(","));
        }
    }
}
