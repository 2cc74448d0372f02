package com.pm.logorganizer.batch;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Summary of one batch invocation.
 *
 * Holds the counts and provides JSON encoding; {@link #toResponseJson()} is the caller-facing contract.
 */
public class BatchOutcome {
    private final int totalRecords;
    private final List<Map.Entry<String, String>> succeeded;
    private final List<RecordFailure> failures;
    private final int groupsProcessed;

    private BatchOutcome(int totalRecords, List<Map.Entry<String, String>> succeeded, List<RecordFailure> failures, int groupsProcessed) {
        this.totalRecords = totalRecords;
        this.succeeded = Collections.unmodifiableList(new ArrayList<>(succeeded));
        this.failures = Collections.unmodifiableList(new ArrayList<>(failures));
        this.groupsProcessed = groupsProcessed;
    }

    public static Builder builder(int totalRecords) {
        return new Builder(totalRecords);
    }

    public int getTotalRecords() {
        return totalRecords;
    }

    public int getSuccessfulRecords() {
        return succeeded.size();
    }

    public int getFailedRecords() {
        return failures.size();
    }

    public int getGroupsProcessed() {
        return groupsProcessed;
    }

    public List<RecordFailure> getFailures() {
        return failures;
    }

    /**
     * (message id, storage key) for each successfully processed message, in processing order.
     */
    public List<Map.Entry<String, String>> getSucceeded() {
        return succeeded;
    }

    /**
     * {@code {"statusCode":200,"body":{"totalRecords":..,"successfulRecords":..,"failedRecords":..,"groupsProcessed":..}}}
     */
    public JsonObject toResponseJson() {
        return new JsonObject()
            .put("statusCode", 200)
            .put("body", countsJson());
    }

    /**
     * Counts plus per-record detail, for logs and job status.
     */
    public JsonObject toJson() {
        JsonArray failuresJson = new JsonArray();
        failures.forEach(f -> failuresJson.add(f.toJson()));

        JsonArray succeededJson = new JsonArray();
        succeeded.forEach(e -> succeededJson.add(new JsonObject().put("messageId", e.getKey()).put("s3Key", e.getValue())));

        return countsJson()
            .put("succeeded", succeededJson)
            .put("failures", failuresJson);
    }

    private JsonObject countsJson() {
        return new JsonObject()
            .put("totalRecords", totalRecords)
            .put("successfulRecords", getSuccessfulRecords())
            .put("failedRecords", getFailedRecords())
            .put("groupsProcessed", groupsProcessed);
    }

    public static class Builder {
        private final int totalRecords;
        private final List<Map.Entry<String, String>> succeeded = new ArrayList<>();
        private final List<RecordFailure> failures = new ArrayList<>();
        private int groupsProcessed;

        private Builder(int totalRecords) {
            this.totalRecords = totalRecords;
        }

        public Builder succeeded(String messageId, String storageKey) {
            succeeded.add(new AbstractMap.SimpleImmutableEntry<>(messageId, storageKey));
            return this;
        }

        public Builder failed(RecordFailure failure) {
            failures.add(failure);
            return this;
        }

        public Builder groupProcessed() {
            groupsProcessed++;
            return this;
        }

        public BatchOutcome build() {
            return new BatchOutcome(totalRecords, succeeded, failures, groupsProcessed);
        }
    }
}
