package com.larpmanager.server.database;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of {@link DatabaseManager#executeRaw(String)}.
 *
 * <p>Exactly one of {@code rows}, {@code updateCount} or {@code error} is set.
 *
 * @param success whether the statement ran and committed
 * @param rows result rows for queries, each row a list of column values
 * @param updateCount affected row count for other statements
 * @param error failure description
 */
public record RawSqlResult(
    @JsonProperty("success") boolean success,
    @JsonProperty("rows") List<List<Object>> rows,
    @JsonProperty("update_count") Integer updateCount,
    @JsonProperty("error") String error
) {

    public static RawSqlResult ofRows(List<List<Object>> rows) {
        return new RawSqlResult(true, List.copyOf(rows), null, null);
    }

    public static RawSqlResult ofUpdateCount(int updateCount) {
        return new RawSqlResult(true, null, updateCount, null);
    }

    public static RawSqlResult failure(String error) {
        return new RawSqlResult(false, null, null, error);
    }
}
