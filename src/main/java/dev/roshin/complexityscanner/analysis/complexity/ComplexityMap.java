package dev.roshin.complexityscanner.analysis.complexity;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedMap;

import java.util.Collections;
import java.util.Map;
import java.util.OptionalInt;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Complexity values of one analysis run, keyed and ordered by function name.
 * <p>
 * Holds one value per name. Recording a name twice (e.g. overloads) keeps the later
 * value; this is a known limitation of keying on the display name.
 */
public class ComplexityMap {

    private final TreeMap<String, Integer> entries = new TreeMap<>();

    /**
     * Records the complexity of a function.
     *
     * @return the value previously recorded under {@code name}, if any
     */
    public OptionalInt record(String name, int complexity) {
        Preconditions.checkNotNull(name, "name");
        Preconditions.checkArgument(complexity >= 1, "complexity must be at least 1, got: %s", complexity);

        Integer previous = entries.put(name, complexity);
        return previous == null ? OptionalInt.empty() : OptionalInt.of(previous);
    }

    public OptionalInt get(String name) {
        Integer value = entries.get(name);
        return value == null ? OptionalInt.empty() : OptionalInt.of(value);
    }

    public boolean contains(String name) {
        return entries.containsKey(name);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Immutable view of the current entries in lexicographic name order.
     */
    public SortedMap<String, Integer> snapshot() {
        return ImmutableSortedMap.copyOfSorted(entries);
    }

    /**
     * Read-only entries in name order.
     */
    Iterable<Map.Entry<String, Integer>> orderedEntries() {
        return Collections.unmodifiableMap(entries).entrySet();
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
