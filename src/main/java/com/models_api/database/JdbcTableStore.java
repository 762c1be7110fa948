package com.models_api.database;

import com.models_api.exception.NotFoundException;
import com.models_api.exception.StorageException;
import com.models_api.util.SqlIdentifiers;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.support.rowset.SqlRowSet;
import org.springframework.jdbc.support.rowset.SqlRowSetMetaData;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link TableStore} over {@link JdbcTemplate}.
 *
 * <p>Schema changes run before the transaction because some databases commit DDL implicitly;
 * the transaction only holds the delete and the batch insert.</p>
 */
@Slf4j
@RequiredArgsConstructor
public class JdbcTableStore implements TableStore {

    private static final String VARCHAR = "VARCHAR";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    @Override
    public List<Map<String, Object>> readTable(String table) {
        String quoted = SqlIdentifiers.quoteTable(table);
        if (columns(quoted).isEmpty()) {
            throw new NotFoundException("Table not found: " + table);
        }
        try {
            List<Map<String, Object>> rows = jdbcTemplate.queryForList("SELECT * FROM " + quoted).stream()
                    .map(row -> (Map<String, Object>) new LinkedHashMap<>(row))
                    .toList();
            log.debug("Read {} rows from table [{}]", rows.size(), table);
            return rows;
        } catch (DataAccessException e) {
            throw new StorageException("Unable to read table " + table, e);
        }
    }

    @Override
    public int replaceTable(String table, List<Map<String, Object>> rows) {
        String quoted = SqlIdentifiers.quoteTable(table);
        Set<String> columns = rows.stream()
                .flatMap(row -> row.keySet().stream())
                .collect(Collectors.toCollection(LinkedHashSet::new));
        columns.forEach(SqlIdentifiers::quoteColumn);

        Optional<Set<String>> existing = columns(quoted);
        if (existing.isEmpty() && columns.isEmpty()) {
            log.warn("⚠️ No rows and no table [{}]; nothing to replace", table);
            return 0;
        }

        try {
            if (existing.isEmpty()) {
                createTable(quoted, columns, rows);
                log.info("📋 Created table [{}] with columns {}", table, columns);
            } else {
                addMissingColumns(quoted, existing.get(), columns, rows);
            }

            List<String> names = new ArrayList<>(columns);
            String insert = "INSERT INTO " + quoted + " ("
                    + names.stream().map(SqlIdentifiers::quoteColumn).collect(Collectors.joining(", "))
                    + ") VALUES (" + names.stream().map(n -> "?").collect(Collectors.joining(", ")) + ")";
            Set<String> textColumns = columns.stream()
                    .filter(column -> existing.map(e -> !e.contains(column)).orElse(true))
                    .filter(column -> VARCHAR.equals(sqlType(column, rows)))
                    .collect(Collectors.toSet());
            List<Object[]> batch = rows.stream()
                    .map(row -> names.stream().map(column -> bind(row.get(column), textColumns.contains(column))).toArray())
                    .toList();

            transactionTemplate.executeWithoutResult(status -> {
                jdbcTemplate.update("DELETE FROM " + quoted);
                if (!batch.isEmpty()) {
                    jdbcTemplate.batchUpdate(insert, batch);
                }
            });
        } catch (DataAccessException e) {
            throw new StorageException("Unable to replace table " + table, e);
        }
        log.info("💾 Replaced table [{}] with {} rows", table, rows.size());
        return rows.size();
    }

    private static Object bind(Object value, boolean text) {
        return text && value != null && !(value instanceof String) ? String.valueOf(value) : value;
    }

    // empty when the table does not exist
    private Optional<Set<String>> columns(String quoted) {
        try {
            SqlRowSet rowSet = jdbcTemplate.queryForRowSet("SELECT * FROM " + quoted + " WHERE 1=0");
            SqlRowSetMetaData meta = rowSet.getMetaData();
            Set<String> names = new LinkedHashSet<>();
            for (int i = 1; i <= meta.getColumnCount(); i++) {
                names.add(meta.getColumnLabel(i));
            }
            return Optional.of(names);
        } catch (BadSqlGrammarException e) {
            return Optional.empty();
        } catch (DataAccessException e) {
            throw new StorageException("Unable to inspect table " + quoted, e);
        }
    }

    private void createTable(String quoted, Set<String> columns, List<Map<String, Object>> rows) {
        String definition = columns.stream()
                .map(column -> SqlIdentifiers.quoteColumn(column) + " " + sqlType(column, rows))
                .collect(Collectors.joining(", "));
        jdbcTemplate.execute("CREATE TABLE " + quoted + " (" + definition + ")");
    }

    private void addMissingColumns(String quoted, Set<String> existing, Set<String> columns, List<Map<String, Object>> rows) {
        for (String column : columns) {
            if (!existing.contains(column)) {
                jdbcTemplate.execute("ALTER TABLE " + quoted + " ADD COLUMN "
                        + SqlIdentifiers.quoteColumn(column) + " " + sqlType(column, rows));
                log.info("➕ Added column [{}] to table {}", column, quoted);
            }
        }
    }

    static String sqlType(String column, List<Map<String, Object>> rows) {
        List<Object> values = rows.stream()
                .map(row -> row.get(column))
                .filter(value -> value != null)
                .toList();
        if (values.isEmpty()) {
            return VARCHAR;
        }
        if (values.stream().allMatch(v -> v instanceof Integer || v instanceof Long || v instanceof Short)) {
            return "BIGINT";
        }
        if (values.stream().allMatch(v -> v instanceof Number)) {
            return "DOUBLE PRECISION";
        }
        if (values.stream().allMatch(v -> v instanceof Boolean)) {
            return "BOOLEAN";
        }
        return VARCHAR;
    }
}
