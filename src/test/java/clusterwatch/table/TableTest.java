package clusterwatch.table;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TableTest {

    record Row(String name, int value) implements Keyed<String> {
        @Override
        public String key() {
            return name;
        }
    }

    private static Table<String, Row> table(Row... rows) {
        return Table.of(List.of(rows));
    }

    @Test
    void putOverwritesByKey() {
        Table<String, Row> t = table(new Row("a", 1));
        t.put(new Row("a", 2));

        assertEquals(1, t.size());
        assertEquals(2, t.get("a").orElseThrow().value());
    }

    @Test
    void diffClassifiesKeys() {
        Table<String, Row> old = table(new Row("keep", 1), new Row("change", 1), new Row("drop", 1));
        Table<String, Row> next = table(new Row("keep", 1), new Row("change", 2), new Row("new", 1));

        TableDiff<String, Row> diff = old.diff(next);

        assertEquals(List.of(new Row("new", 1)), diff.added());
        assertEquals(List.of(new Row("change", 2)), diff.changed());
        assertEquals(List.of("drop"), diff.removed());
    }

    @Test
    void diffOfTableWithItselfIsEmpty() {
        Table<String, Row> t = table(new Row("a", 1), new Row("b", 2));

        TableDiff<String, Row> diff = t.diff(t.copy());

        assertTrue(diff.isEmpty());
        assertEquals(0, diff.size());
    }

    @Test
    void keyAppearsInAtMostOneSet() {
        Table<String, Row> old = table(new Row("a", 1), new Row("b", 1), new Row("c", 1));
        Table<String, Row> next = table(new Row("b", 9), new Row("c", 1), new Row("d", 1));

        TableDiff<String, Row> diff = old.diff(next);

        Set<String> seen = new HashSet<>();
        diff.added().forEach(r -> assertTrue(seen.add(r.key())));
        diff.changed().forEach(r -> assertTrue(seen.add(r.key())));
        diff.removed().forEach(k -> assertTrue(seen.add(k)));
    }

    @Test
    void applyingDiffReproducesTarget() {
        Table<String, Row> old = table(new Row("a", 1), new Row("b", 1));
        Table<String, Row> next = table(new Row("b", 2), new Row("c", 3));

        Table<String, Row> replica = old.copy();
        replica.apply(old.diff(next));

        assertEquals(next, replica);
    }

    @Test
    void applyIsIdempotent() {
        Table<String, Row> old = table(new Row("a", 1), new Row("b", 1));
        Table<String, Row> next = table(new Row("b", 2), new Row("c", 3));
        TableDiff<String, Row> diff = old.diff(next);

        Table<String, Row> once = old.copy();
        once.apply(diff);
        Table<String, Row> twice = old.copy();
        twice.apply(diff);
        twice.apply(diff);

        assertEquals(once, twice);
    }

    @Test
    void applyToleratesDivergedBase() {
        // replica missed an earlier update of "a" and never saw "z"
        Table<String, Row> replica = table(new Row("a", 0));
        TableDiff<String, Row> diff = new TableDiff<>(
                List.of(new Row("c", 3)), List.of(new Row("a", 5)), List.of("z"));

        replica.apply(diff);

        assertEquals(table(new Row("a", 5), new Row("c", 3)), replica);
    }

    @Test
    void copyIsIndependent() {
        Table<String, Row> t = table(new Row("a", 1));
        Table<String, Row> copy = t.copy();
        copy.put(new Row("b", 2));
        copy.remove("a");

        assertTrue(t.contains("a"));
        assertFalse(t.contains("b"));
    }

    @Test
    void diffSummaryCountsEachList() {
        TableDiff<String, Row> diff = new TableDiff<>(List.of(new Row("x", 1)), null, List.of("y", "z"));

        assertEquals("+1 ~0 -2", diff.toString());
        assertEquals(3, diff.size());
    }
}
