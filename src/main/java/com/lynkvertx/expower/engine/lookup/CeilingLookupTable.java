package com.lynkvertx.expower.engine.lookup;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable breakpoint table resolved by ceiling lookup.
 *
 * A query returns the value of the smallest breakpoint that is &gt;= the query, so equipment is
 * always rated at or above demand. Queries above the largest breakpoint clamp to the last entry.
 * Breakpoints must be finite and strictly ascending.
 *
 * @param <V> value type stored against each breakpoint
 */
@ToString
@EqualsAndHashCode
public final class CeilingLookupTable<V> {

    private final List<Entry<V>> entries;

    private CeilingLookupTable(List<Entry<V>> entries) {
        double previous = Double.NEGATIVE_INFINITY;
        for (Entry<V> entry : entries) {
            if (!Double.isFinite(entry.getBreakpoint())) {
                throw new IllegalArgumentException("Breakpoint must be finite: " + entry.getBreakpoint());
            }
            if (entry.getBreakpoint() <= previous) {
                throw new IllegalArgumentException(String.format(
                    "Breakpoints must be strictly ascending: %s follows %s", entry.getBreakpoint(), previous));
            }
            previous = entry.getBreakpoint();
        }
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public static <V> Builder<V> builder() {
        return new Builder<>();
    }

    public static <V> CeilingLookupTable<V> empty() {
        return new CeilingLookupTable<>(Collections.emptyList());
    }

    /**
     * Resolve the entry covering {@code key}.
     *
     * @return the covering entry, the largest entry when {@code key} exceeds every breakpoint,
     * or empty when the table has no entries
     */
    public Optional<Entry<V>> lookupEntry(double key) {
        if (entries.isEmpty()) {
            return Optional.empty();
        }
        for (Entry<V> entry : entries) {
            if (key <= entry.getBreakpoint()) {
                return Optional.of(entry);
            }
        }
        return Optional.of(maxEntry());
    }

    public Optional<V> lookup(double key) {
        return lookupEntry(key).map(Entry::getValue);
    }

    /**
     * Whether {@code key} lies above every breakpoint, i.e. a lookup would be clamped.
     */
    public boolean exceedsRange(double key) {
        return !entries.isEmpty() && key > maxEntry().getBreakpoint();
    }

    List<Entry<V>> entries() {
        return entries;
    }

    int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    private Entry<V> maxEntry() {
        return entries.get(entries.size() - 1);
    }

    @Getter
    @ToString
    @EqualsAndHashCode
    public static final class Entry<V> {
        private final double breakpoint;
        private final V value;

        Entry(double breakpoint, V value) {
            this.breakpoint = breakpoint;
            this.value = Objects.requireNonNull(value, "value");
        }
    }

    public static final class Builder<V> {
        private final List<Entry<V>> entries = new ArrayList<>();

        private Builder() {
        }

        public Builder<V> entry(double breakpoint, V value) {
            entries.add(new Entry<>(breakpoint, value));
            return this;
        }

        public CeilingLookupTable<V> build() {
            return new CeilingLookupTable<>(entries);
        }
    }
}
