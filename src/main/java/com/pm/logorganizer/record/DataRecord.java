package com.pm.logorganizer.record;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

/**
 * A decoded audit-log record.
 *
 * The partitioning attributes are exposed as typed, optional (nullable) fields. The complete decoded
 * document is kept as well, since that is what gets persisted.
 */
public class DataRecord {
    public static final String MESSAGE_TYPE = "messageType";
    public static final String PROJECT_CODE = "projectCode";
    public static final String PARTNER = "partner";
    public static final String CUSTOMER = "customer";
    public static final String CLIENT_ID = "clientId";
    public static final String API_KEY_ID = "apiKeyId";
    public static final String REGION = "region";
    public static final String COUNTRY = "country";
    public static final String COMPONENT = "component";
    public static final String ENV = "env";
    public static final String DATE_TIME = "dateTime";

    private final JsonObject document;
    private final String messageType;
    private final String projectCode;
    private final String partner;
    private final String customer;
    private final String clientId;
    private final String apiKeyId;
    private final String region;
    private final String country;
    private final String component;
    private final String env;
    private final String dateTime;
    private final Object dateTimeValue;

    private DataRecord(JsonObject document) {
        this.document = document;
        this.messageType = asText(document.getValue(MESSAGE_TYPE));
        this.projectCode = asText(document.getValue(PROJECT_CODE));
        this.partner = asText(document.getValue(PARTNER));
        this.customer = asText(document.getValue(CUSTOMER));
        this.clientId = asText(document.getValue(CLIENT_ID));
        // 0 and false carry no key, same as absent
        Object rawApiKeyId = document.getValue(API_KEY_ID);
        this.apiKeyId = RecordValidator.isPresent(rawApiKeyId) ? asText(rawApiKeyId) : null;
        this.region = asText(document.getValue(REGION));
        this.country = asText(document.getValue(COUNTRY));
        this.component = asText(document.getValue(COMPONENT));
        this.env = asText(document.getValue(ENV));
        this.dateTimeValue = document.getValue(DATE_TIME);
        this.dateTime = asText(this.dateTimeValue);
    }

    public static DataRecord fromJson(JsonObject document) {
        return new DataRecord(document.copy());
    }

    /**
     * Renders a scalar JSON value as the text used in partition segments; null stays null.
     */
    static String asText(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof JsonObject) {
            return ((JsonObject) value).encode();
        }
        if (value instanceof JsonArray) {
            return ((JsonArray) value).encode();
        }
        if (value instanceof Double && ((Double) value) == Math.rint((Double) value) && !Double.isInfinite((Double) value)) {
            // 5.0 renders as 5, the way the producers wrote it
            return String.valueOf(((Double) value).longValue());
        }
        return String.valueOf(value);
    }

    public JsonObject toJson() {
        return document.copy();
    }

    public String encode() {
        return document.encode();
    }

    public String getMessageType() {
        return messageType;
    }

    public String getProjectCode() {
        return projectCode;
    }

    public String getPartner() {
        return partner;
    }

    public String getCustomer() {
        return customer;
    }

    public String getClientId() {
        return clientId;
    }

    public String getApiKeyId() {
        return apiKeyId;
    }

    public String getRegion() {
        return region;
    }

    public String getCountry() {
        return country;
    }

    public String getComponent() {
        return component;
    }

    public String getEnv() {
        return env;
    }

    /**
     * True when the record carries a non-empty, non-false environment value.
     */
    public boolean hasEnv() {
        return RecordValidator.isPresent(document.getValue(ENV));
    }

    public String getDateTime() {
        return dateTime;
    }

    /**
     * The timestamp as decoded: a {@link Number} (epoch millis), a {@link String}, or null.
     */
    public Object getDateTimeValue() {
        return dateTimeValue;
    }

    @Override
    public String toString() {
        return document.encode();
    }
}
