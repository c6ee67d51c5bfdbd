package de.bsommerfeld.sqlserve.server.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import de.bsommerfeld.sqlserve.core.domain.CanonicalAddress;
import de.bsommerfeld.sqlserve.core.domain.RowSet;

import java.util.List;

/**
 * A successful database, table or row response. {@code table} is omitted at
 * database level; {@code row_paths} only appears in table listings of tables
 * with a declared primary key.
 */
@JsonPropertyOrder({ "ok", "database", "database_hash", "table", "columns", "rows", "row_paths" })
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DataPayload(
        boolean ok,
        String database,
        @JsonProperty("database_hash") String databaseHash,
        String table,
        List<String> columns,
        List<List<Object>> rows,
        @JsonProperty("row_paths") List<String> rowPaths) {

    public static DataPayload of(CanonicalAddress address, String table, RowSet rows, List<String> rowPaths) {
        return new DataPayload(true, address.name(), address.hashPrefix(), table, rows.columns(), rows.rows(),
                rowPaths);
    }
}
