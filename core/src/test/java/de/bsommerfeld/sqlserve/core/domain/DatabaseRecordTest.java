package de.bsommerfeld.sqlserve.core.domain;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DatabaseRecordTest {

    private static final String DIGEST = "0123456789abcdef0123456789abcdef0123456789abcdef0123456789abcdef";

    @Test
    void hashPrefix_shouldBeFirstSevenHexChars() {
        DatabaseRecord record = new DatabaseRecord("sales", DIGEST, "sales.db", Map.of());
        assertEquals("0123456", record.hashPrefix());
    }

    @Test
    void tables_shouldKeepInsertionOrderAndBeImmutable() {
        Map<String, Long> tables = new LinkedHashMap<>();
        tables.put("zeta", 1L);
        tables.put("alpha", 2L);
        DatabaseRecord record = new DatabaseRecord("sales", DIGEST, "sales.db", tables);

        assertEquals(List.of("zeta", "alpha"), List.copyOf(record.tables().keySet()));
        assertThrows(UnsupportedOperationException.class, () -> record.tables().put("x", 0L));
        assertTrue(record.hasTable("alpha"));
        assertFalse(record.hasTable("beta"));
    }

    @Test
    void constructor_shouldRejectShortDigest() {
        assertThrows(IllegalArgumentException.class, () -> new DatabaseRecord("x", "abc", "x.db", Map.of()));
    }

    @Test
    void queryResult_shouldExposeExactlyOneSide() {
        QueryResult ok = QueryResult.ok(new RowSet(List.of("a"), List.of(List.of(1L))));
        QueryResult failed = QueryResult.error("near \"selec\": syntax error");

        assertTrue(ok.isOk());
        assertEquals(1, ok.rows().size());
        assertThrows(IllegalStateException.class, ok::error);

        assertFalse(failed.isOk());
        assertEquals("near \"selec\": syntax error", failed.error().message());
        assertThrows(IllegalStateException.class, failed::rows);
    }
}
