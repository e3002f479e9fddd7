package clusterwatch.table;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Changeset for one table: values only in the new snapshot, values whose key is in
 * both snapshots but whose value changed, and keys only in the old snapshot.
 * A key appears in at most one of the three lists.
 *
 * @param <K> key type
 * @param <V> value type
 */
public record TableDiff<K, V>(
        @JsonProperty("added") List<V> added,
        @JsonProperty("changed") List<V> changed,
        @JsonProperty("removed") List<K> removed) {

    public TableDiff {
        added = added == null ? List.of() : List.copyOf(added);
        changed = changed == null ? List.of() : List.copyOf(changed);
        removed = removed == null ? List.of() : List.copyOf(removed);
    }

    public static <K, V> TableDiff<K, V> empty() {
        return new TableDiff<>(List.of(), List.of(), List.of());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return added.isEmpty() && changed.isEmpty() && removed.isEmpty();
    }

    /** Number of entries across all three lists. */
    public int size() {
        return added.size() + changed.size() + removed.size();
    }

    @Override
    public String toString() {
        return "+" + added.size() + " ~" + changed.size() + " -" + removed.size();
    }
}
