package clusterwatch.table;

/**
 * A value that knows its own unique key within a {@link Table}.
 * Keys must have structural {@code equals}/{@code hashCode}.
 *
 * @param <K> key type
 */
public interface Keyed<K> {

    K key();
}
