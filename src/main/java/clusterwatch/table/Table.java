package clusterwatch.table;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Mapping from a unique key to a value, with set reconciliation.
 *
 * Inserting a value whose key is already present replaces the old value; no history is kept.
 * {@link #diff(Table)} computes the changeset that turns this table into another, and
 * {@link #apply(TableDiff)} replays such a changeset.
 *
 * Not thread-safe. Each table is owned by one loop.
 *
 * @param <K> key type
 * @param <V> value type
 */
public final class Table<K, V extends Keyed<K>> {

    private final Map<K, V> rows;

    public Table() {
        this.rows = new LinkedHashMap<>();
    }

    private Table(Map<K, V> rows) {
        this.rows = rows;
    }

    public static <K, V extends Keyed<K>> Table<K, V> of(Collection<? extends V> values) {
        Table<K, V> table = new Table<>();
        for (V value : values) {
            table.put(value);
        }
        return table;
    }

    /** Insert or overwrite by key. */
    public void put(V value) {
        Objects.requireNonNull(value, "value");
        rows.put(value.key(), value);
    }

    public Optional<V> get(K key) {
        return Optional.ofNullable(rows.get(key));
    }

    public boolean contains(K key) {
        return rows.containsKey(key);
    }

    public boolean remove(K key) {
        return rows.remove(key) != null;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public Set<K> keys() {
        return Collections.unmodifiableSet(rows.keySet());
    }

    @JsonValue
    public List<V> values() {
        return List.copyOf(rows.values());
    }

    public Table<K, V> copy() {
        return new Table<>(new LinkedHashMap<>(rows));
    }

    /**
     * Changeset that turns this table into {@code next}.
     *
     * Keys only in {@code next} are added, keys only here are removed, and keys in both are
     * reported as changed with the new value unless the two values are equal.
     */
    public TableDiff<K, V> diff(Table<K, V> next) {
        List<V> added = new ArrayList<>();
        List<V> changed = new ArrayList<>();
        List<K> removed = new ArrayList<>();

        for (Map.Entry<K, V> entry : rows.entrySet()) {
            V newValue = next.rows.get(entry.getKey());
            if (newValue == null) {
                removed.add(entry.getKey());
            } else if (!newValue.equals(entry.getValue())) {
                changed.add(newValue);
            }
        }
        for (Map.Entry<K, V> entry : next.rows.entrySet()) {
            if (!rows.containsKey(entry.getKey())) {
                added.add(entry.getValue());
            }
        }
        return new TableDiff<>(added, changed, removed);
    }

    /**
     * Upsert every added and changed value, then delete every removed key.
     * Does not require this table to be in the diff's base state, and applying the same
     * diff twice leaves the table as after the first application.
     */
    public void apply(TableDiff<K, V> diff) {
        for (V value : diff.added()) {
            put(value);
        }
        for (V value : diff.changed()) {
            put(value);
        }
        for (K key : diff.removed()) {
            rows.remove(key);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Table<?, ?> other))
            return false;
        return rows.equals(other.rows);
    }

    @Override
    public int hashCode() {
        return rows.hashCode();
    }

    @Override
    public String toString() {
        return "Table{size=" + rows.size() + "}";
    }
}
