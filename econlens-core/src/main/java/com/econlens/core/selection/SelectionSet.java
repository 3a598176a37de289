package com.econlens.core.selection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Capacity-bounded, insertion-ordered set of series identifiers chosen for comparison.
 * Immutable: every mutation returns a new set.
 */
public final class SelectionSet {

    private final int capacity;
    private final List<String> ids;

    private SelectionSet(int capacity, List<String> ids) {
        this.capacity = capacity;
        this.ids = ids;
    }

    public static SelectionSet empty(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1: " + capacity);
        }
        return new SelectionSet(capacity, List.of());
    }

    /**
     * Build a set from initial identifiers. Duplicates are ignored and
     * identifiers beyond capacity are dropped, same as repeated toggles would.
     */
    public static SelectionSet of(int capacity, List<String> initial) {
        SelectionSet set = empty(capacity);
        for (String id : initial) {
            if (!set.contains(id)) {
                set = set.toggle(id);
            }
        }
        return set;
    }

    /**
     * Remove {@code id} if present, otherwise append it if there is room.
     * A full set is returned unchanged.
     */
    public SelectionSet toggle(String id) {
        Objects.requireNonNull(id, "id");
        if (ids.contains(id)) {
            List<String> next = new ArrayList<>(ids);
            next.remove(id);
            return new SelectionSet(capacity, Collections.unmodifiableList(next));
        }
        if (ids.size() >= capacity) {
            return this;
        }
        List<String> next = new ArrayList<>(ids.size() + 1);
        next.addAll(ids);
        next.add(id);
        return new SelectionSet(capacity, Collections.unmodifiableList(next));
    }

    public SelectionSet clear() {
        return ids.isEmpty() ? this : new SelectionSet(capacity, List.of());
    }

    public boolean isAtCapacity() {
        return ids.size() >= capacity;
    }

    public boolean contains(String id) {
        return ids.contains(id);
    }

    /**
     * Current position of {@code id}, or -1.
     */
    public int indexOf(String id) {
        return ids.indexOf(id);
    }

    public List<String> ids() {
        return ids;
    }

    public int size() {
        return ids.size();
    }

    public boolean isEmpty() {
        return ids.isEmpty();
    }

    public int capacity() {
        return capacity;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SelectionSet other)) return false;
        return capacity == other.capacity && ids.equals(other.ids);
    }

    @Override
    public int hashCode() {
        return Objects.hash(capacity, ids);
    }

    @Override
    public String toString() {
        return "SelectionSet" + ids + "/" + capacity;
    }
}
