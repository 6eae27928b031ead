package db.compiler.storage;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

public class RecordTest {

    @Test
    void keepsNullCellsAndIsUnmodifiable() {
        Record r = new Record(Arrays.asList("Ann", null, 22.0));
        assertEquals(3, r.size());
        assertNull(r.get(1));
        assertThrows(UnsupportedOperationException.class, () -> r.getValues().add("x"));
    }

    @Test
    void copiesItsInput() {
        List<Object> values = new ArrayList<>(List.of("a", "b"));
        Record r = new Record(values);
        values.set(0, "changed");
        assertEquals("a", r.get(0));
        assertEquals(new Record(List.of("a", "b")), r);
    }
}
