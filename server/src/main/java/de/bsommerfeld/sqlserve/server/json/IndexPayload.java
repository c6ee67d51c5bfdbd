package de.bsommerfeld.sqlserve.server.json;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import de.bsommerfeld.sqlserve.core.domain.DatabaseRecord;
import de.bsommerfeld.sqlserve.db.PathSegments;

import java.util.List;
import java.util.Map;

/** The root listing: every registered database with its canonical path. */
@JsonPropertyOrder({ "ok", "databases" })
public record IndexPayload(boolean ok, List<Entry> databases) {

    public static IndexPayload of(List<DatabaseRecord> records) {
        return new IndexPayload(true, records.stream().map(Entry::of).toList());
    }

    @JsonPropertyOrder({ "name", "hash", "hash_prefix", "path", "tables" })
    public record Entry(
            String name,
            String hash,
            @JsonProperty("hash_prefix") String hashPrefix,
            String path,
            Map<String, Long> tables) {

        static Entry of(DatabaseRecord record) {
            String path = "/" + PathSegments.encode(record.name()) + "-" + record.hashPrefix();
            return new Entry(record.name(), record.digest(), record.hashPrefix(), path, record.tables());
        }
    }
}
