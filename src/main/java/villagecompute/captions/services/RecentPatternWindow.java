package villagecompute.captions.services;

import villagecompute.captions.data.models.PriceTier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A creator's most recent assignments, newest first.
 *
 * <p>
 * Built per selection request from the assignment history and never persisted.
 */
public final class RecentPatternWindow {

    /** Entries kept; covers the longest lookback any rule uses. */
    public static final int MAX_ENTRIES = 10;

    private static final RecentPatternWindow EMPTY = new RecentPatternWindow(List.of());

    private final List<PatternEntry> entries;

    public RecentPatternWindow(List<PatternEntry> newestFirst) {
        List<PatternEntry> copy = new ArrayList<>(newestFirst.subList(0, Math.min(MAX_ENTRIES, newestFirst.size())));
        this.entries = Collections.unmodifiableList(copy);
    }

    public static RecentPatternWindow empty() {
        return EMPTY;
    }

    public List<PatternEntry> entries() {
        return entries;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /** True when the tag occurs among the newest {@code lookback} entries. */
    public boolean containsTriggerTag(String tag, int lookback) {
        return tag != null && newest(lookback).stream().anyMatch(e -> tag.equalsIgnoreCase(e.triggerTag()));
    }

    /** True when the category occurs among the newest {@code lookback} entries. */
    public boolean containsCategory(String category, int lookback) {
        return category != null && newest(lookback).stream().anyMatch(e -> category.equalsIgnoreCase(e.category()));
    }

    /** Number of times the tier occurs among the newest {@code lookback} entries. */
    public int countTier(PriceTier tier, int lookback) {
        return (int) newest(lookback).stream().filter(e -> Objects.equals(tier, e.priceTier())).count();
    }

    /**
     * Returns the entries oldest first, the order in which consecutive-run rules read them.
     */
    public List<PatternEntry> chronological() {
        List<PatternEntry> reversed = new ArrayList<>(entries);
        Collections.reverse(reversed);
        return reversed;
    }

    private List<PatternEntry> newest(int lookback) {
        return entries.subList(0, Math.min(Math.max(lookback, 0), entries.size()));
    }
}
