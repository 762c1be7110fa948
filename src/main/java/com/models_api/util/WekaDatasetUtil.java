package com.models_api.util;

import lombok.extern.slf4j.Slf4j;
import weka.core.Attribute;
import weka.core.DenseInstance;
import weka.core.Instance;
import weka.core.Instances;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts row maps into Weka {@link Instances}. A column is numeric when every non-null value
 * is a {@link Number}, nominal otherwise.
 */
@Slf4j
public class WekaDatasetUtil {

    private WekaDatasetUtil() {
    }

    public static Instances toInstances(String relation, List<Map<String, Object>> rows, String targetColumn) {
        if (rows == null || rows.isEmpty()) {
            throw new IllegalArgumentException("At least one row is required");
        }
        Map<String, Set<String>> nominalValues = new LinkedHashMap<>();
        Map<String, Boolean> numeric = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            row.forEach((column, value) -> {
                numeric.putIfAbsent(column, Boolean.TRUE);
                nominalValues.putIfAbsent(column, new LinkedHashSet<>());
                if (value != null) {
                    if (!(value instanceof Number)) {
                        numeric.put(column, Boolean.FALSE);
                    }
                    nominalValues.get(column).add(String.valueOf(value));
                }
            });
        }

        ArrayList<Attribute> attributes = new ArrayList<>();
        for (String column : numeric.keySet()) {
            if (numeric.get(column)) {
                attributes.add(new Attribute(column));
            } else {
                attributes.add(new Attribute(column, new ArrayList<>(nominalValues.get(column))));
            }
        }

        Instances data = new Instances(relation, attributes, rows.size());
        String classColumn = targetColumn != null ? targetColumn : attributes.get(attributes.size() - 1).name();
        Attribute classAttribute = data.attribute(classColumn);
        if (classAttribute == null) {
            throw new IllegalArgumentException("Target column '" + classColumn + "' is not present in the data");
        }
        data.setClassIndex(classAttribute.index());
        log.debug("Built dataset [{}] with {} attributes, class='{}'", relation, attributes.size(), classColumn);

        for (Map<String, Object> row : rows) {
            data.add(toInstance(data, row, false));
        }
        return data;
    }

    /**
     * Builds an instance against an existing header. Values the header cannot represent become missing.
     */
    public static Instance toInstance(Instances header, Map<String, Object> row, boolean classMissing) {
        Instance instance = new DenseInstance(header.numAttributes());
        instance.setDataset(header);
        for (int i = 0; i < header.numAttributes(); i++) {
            Attribute attribute = header.attribute(i);
            Object value = row.get(attribute.name());
            if (value == null || (classMissing && i == header.classIndex())) {
                instance.setMissing(i);
            } else if (attribute.isNumeric()) {
                if (value instanceof Number number) {
                    instance.setValue(i, number.doubleValue());
                } else {
                    instance.setMissing(i);
                }
            } else {
                int index = attribute.indexOfValue(String.valueOf(value));
                if (index < 0) {
                    instance.setMissing(i);
                } else {
                    instance.setValue(i, index);
                }
            }
        }
        return instance;
    }
}
