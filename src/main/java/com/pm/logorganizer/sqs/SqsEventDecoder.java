package com.pm.logorganizer.sqs;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Decodes a delivered batch in the queue-trigger event shape:
 * <pre>
 * {"Records": [{"messageId": "..", "receiptHandle": "..", "eventSourceARN": "arn:aws:sqs:..", "body": ".."}]}
 * </pre>
 */
public class SqsEventDecoder {
    private SqsEventDecoder() {
    }

    /**
     * @throws IllegalArgumentException if the envelope has no {@code Records} array
     */
    public static List<SqsRawMessage> decode(JsonObject event) {
        if (event == null) {
            throw new IllegalArgumentException("event is null");
        }
        Object records = event.getValue("Records");
        if (!(records instanceof JsonArray)) {
            throw new IllegalArgumentException("event has no Records array");
        }

        List<SqsRawMessage> messages = new ArrayList<>();
        for (Object entry : (JsonArray) records) {
            if (!(entry instanceof JsonObject)) {
                throw new IllegalArgumentException("event record is not an object: " + entry);
            }
            JsonObject record = (JsonObject) entry;
            messages.add(new SqsRawMessage(
                record.getString("messageId"),
                record.getString("receiptHandle"),
                bodyOf(record),
                record.getString("eventSourceARN")));
        }
        return messages;
    }

    private static String bodyOf(JsonObject record) {
        Object body = record.getValue("body");
        return body == null ? null : body.toString();
    }
}
