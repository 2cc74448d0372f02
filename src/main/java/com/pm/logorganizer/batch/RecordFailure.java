package com.pm.logorganizer.batch;

import io.vertx.core.json.JsonObject;

public class RecordFailure {
    private final String messageId;
    private final FailureReason reason;
    private final String error;

    public RecordFailure(String messageId, FailureReason reason, String error) {
        this.messageId = messageId;
        this.reason = reason;
        this.error = error;
    }

    public String getMessageId() {
        return messageId;
    }

    public FailureReason getReason() {
        return reason;
    }

    public String getError() {
        return error;
    }

    public JsonObject toJson() {
        return new JsonObject()
            .put("messageId", messageId)
            .put("reason", reason.name())
            .put("error", error);
    }

    @Override
    public String toString() {
        return String.format("RecordFailure{messageId=%s, reason=%s, error=%s}", messageId, reason, error);
    }
}
