package com.gt.lift.ranges;

import com.gt.lift.model.Range;
import com.gt.lift.model.RangeElement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable lookup over the ranges of one ranges document. Hierarchies are expressed through
 * {@link RangeElement#parent()} ids within a range; a parent that is not in the range makes the element a root.
 */
public final class RangesRegistry {

    public static final RangesRegistry EMPTY = new RangesRegistry(List.of());

    private final Map<String, Range> ranges;
    private final Map<String, Map<String, RangeElement>> elementsByRange;

    // A duplicate range id keeps the first range
    public RangesRegistry(List<Range> ranges) {
        Map<String, Range> byId = new LinkedHashMap<>();
        Map<String, Map<String, RangeElement>> elements = new LinkedHashMap<>();
        for (Range range : ranges) {
            if (byId.putIfAbsent(range.id(), range) == null) {
                Map<String, RangeElement> rangeElements = new LinkedHashMap<>();
                range.elements().forEach(element -> rangeElements.putIfAbsent(element.id(), element));
                elements.put(range.id(), Collections.unmodifiableMap(rangeElements));
            }
        }
        this.ranges = Collections.unmodifiableMap(byId);
        this.elementsByRange = Collections.unmodifiableMap(elements);
    }

    public Set<String> rangeIds() {
        return ranges.keySet();
    }

    public List<Range> ranges() {
        return List.copyOf(ranges.values());
    }

    public Optional<Range> range(String rangeId) {
        return Optional.ofNullable(ranges.get(rangeId));
    }

    public boolean hasRange(String rangeId) {
        return ranges.containsKey(rangeId);
    }

    public List<RangeElement> elements(String rangeId) {
        return List.copyOf(elementsByRange.getOrDefault(rangeId, Map.of()).values());
    }

    public Optional<RangeElement> element(String rangeId, String elementId) {
        return Optional.ofNullable(elementsByRange.getOrDefault(rangeId, Map.of()).get(elementId));
    }

    // First match across ranges, in document order
    public Optional<RangeElement> findElement(String elementId) {
        for (Map<String, RangeElement> elements : elementsByRange.values()) {
            RangeElement element = elements.get(elementId);
            if (element != null) {
                return Optional.of(element);
            }
        }
        return Optional.empty();
    }

    public List<RangeElement> roots(String rangeId) {
        Map<String, RangeElement> elements = elementsByRange.getOrDefault(rangeId, Map.of());
        return elements.values().stream()
                .filter(element -> element.parent() == null || !elements.containsKey(element.parent()))
                .toList();
    }

    public List<RangeElement> children(String rangeId, String elementId) {
        return elementsByRange.getOrDefault(rangeId, Map.of()).values().stream()
                .filter(element -> elementId.equals(element.parent()))
                .toList();
    }

    /**
     * Parent chain of an element, nearest first. Stops at the first repeated id, so cyclic parent
     * references terminate.
     */
    public List<RangeElement> ancestors(String rangeId, String elementId) {
        Map<String, RangeElement> elements = elementsByRange.getOrDefault(rangeId, Map.of());
        List<RangeElement> ancestors = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        visited.add(elementId);

        RangeElement current = elements.get(elementId);
        while (current != null && current.parent() != null && visited.add(current.parent())) {
            current = elements.get(current.parent());
            if (current != null) {
                ancestors.add(current);
            }
        }
        return ancestors;
    }

    public boolean contains(String rangeId, String value) {
        return elementsByRange.getOrDefault(rangeId, Map.of()).containsKey(value);
    }

    public boolean isEmpty() {
        return ranges.isEmpty();
    }
}
