package me.bechberger.plumbr.engine;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Immutable, ordered set of redaction patterns, unique by name.
 * <p>
 * Registration order is significant: the scanner uses it to break ties between
 * patterns that match at the same offset. Merging never mutates a set, it returns
 * a new one in which a pattern with an already known name takes over the slot of
 * the earlier pattern instead of being appended.
 */
public final class PatternSet implements Iterable<RedactionPattern> {

    private static final PatternSet EMPTY = new PatternSet(List.of());

    private final List<RedactionPattern> patterns;
    private final Map<String, Integer> indexByName;

    private PatternSet(List<RedactionPattern> patterns) {
        this.patterns = Collections.unmodifiableList(patterns);
        Map<String, Integer> index = new LinkedHashMap<>();
        for (int i = 0; i < patterns.size(); i++) {
            index.put(patterns.get(i).getName(), i);
        }
        this.indexByName = Collections.unmodifiableMap(index);
    }

    public static PatternSet empty() {
        return EMPTY;
    }

    /**
     * Create a set from patterns in registration order, later duplicates override earlier ones.
     */
    public static PatternSet of(Collection<RedactionPattern> patterns) {
        return EMPTY.withAll(patterns);
    }

    /**
     * Return a new set with the given pattern merged in.
     */
    public PatternSet with(RedactionPattern pattern) {
        return withAll(List.of(pattern));
    }

    /**
     * Return a new set with the given patterns merged in, in order.
     */
    public PatternSet withAll(Collection<RedactionPattern> additions) {
        if (additions.isEmpty()) {
            return this;
        }
        LinkedHashMap<String, RedactionPattern> merged = new LinkedHashMap<>();
        for (RedactionPattern pattern : patterns) {
            merged.put(pattern.getName(), pattern);
        }
        for (RedactionPattern pattern : additions) {
            // LinkedHashMap keeps the original insertion slot on re-put
            merged.put(pattern.getName(), pattern);
        }
        return new PatternSet(new ArrayList<>(merged.values()));
    }

    /**
     * Return a new set containing only the patterns accepted by the filter.
     */
    public PatternSet filter(Predicate<RedactionPattern> filter) {
        List<RedactionPattern> kept = new ArrayList<>();
        for (RedactionPattern pattern : patterns) {
            if (filter.test(pattern)) {
                kept.add(pattern);
            }
        }
        return kept.size() == patterns.size() ? this : new PatternSet(kept);
    }

    public RedactionPattern get(int index) {
        return patterns.get(index);
    }

    @Nullable
    public RedactionPattern get(String name) {
        Integer index = indexByName.get(name);
        return index == null ? null : patterns.get(index);
    }

    public boolean contains(String name) {
        return indexByName.containsKey(name);
    }

    public int size() {
        return patterns.size();
    }

    public boolean isEmpty() {
        return patterns.isEmpty();
    }

    public Set<String> names() {
        return indexByName.keySet();
    }

    /**
     * Distinct categories in registration order.
     */
    public Set<String> categories() {
        Set<String> categories = new LinkedHashSet<>();
        for (RedactionPattern pattern : patterns) {
            categories.add(pattern.getCategory());
        }
        return Collections.unmodifiableSet(categories);
    }

    public List<RedactionPattern> asList() {
        return patterns;
    }

    public Stream<RedactionPattern> stream() {
        return patterns.stream();
    }

    @Override
    public Iterator<RedactionPattern> iterator() {
        return patterns.iterator();
    }

    @Override
    public String toString() {
        return "PatternSet" + names();
    }
}
