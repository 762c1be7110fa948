package com.models_api.database;

import java.util.List;
import java.util.Map;

/**
 * Relational tables used as model input and output.
 */
public interface TableStore {

    /**
     * @throws com.models_api.exception.NotFoundException when the table does not exist
     */
    List<Map<String, Object>> readTable(String table);

    /**
     * Replaces the content of {@code table} with {@code rows} in one transaction, creating the
     * table or missing columns first. Readers see either the old rows or the new ones.
     *
     * @return number of rows written
     */
    int replaceTable(String table, List<Map<String, Object>> rows);
}
