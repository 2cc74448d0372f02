package com.pm.logorganizer.record;

import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Shallow presence check of a decoded message body against a list of required fields.
 */
public class RecordValidator {
    public static final List<String> DEFAULT_REQUIRED_FIELDS = Collections.unmodifiableList(List.of(
            DataRecord.MESSAGE_TYPE, DataRecord.PROJECT_CODE, DataRecord.COMPONENT));

    private final List<String> requiredFields;

    public RecordValidator() {
        this(DEFAULT_REQUIRED_FIELDS);
    }

    public RecordValidator(List<String> requiredFields) {
        this.requiredFields = List.copyOf(requiredFields);
    }

    /**
     * Returns the names of required fields that are missing from the decoded body.
     * A field counts as missing when it is absent, null, an empty string, zero or false.
     * Anything that is not a JSON object is missing every required field.
     *
     * @param decoded value produced by decoding the message body, of any shape
     * @return missing field names in required-field order, empty when the record is valid
     */
    public List<String> missingFields(Object decoded) {
        JsonObject record = asJsonObject(decoded);
        if (record == null) {
            return requiredFields;
        }

        List<String> missing = new ArrayList<>();
        for (String field : requiredFields) {
            if (!isPresent(record.getValue(field))) {
                missing.add(field);
            }
        }
        return missing;
    }

    public List<String> getRequiredFields() {
        return requiredFields;
    }

    /**
     * @return the decoded value as a JSON object, or null when it is not one
     */
    public static JsonObject asJsonObject(Object decoded) {
        return decoded instanceof JsonObject ? (JsonObject) decoded : null;
    }

    static boolean isPresent(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof String) {
            return !((String) value).isEmpty();
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            return d != 0 && !Double.isNaN(d);
        }
        return true;
    }
}
