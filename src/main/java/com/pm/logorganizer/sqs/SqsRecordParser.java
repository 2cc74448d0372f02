package com.pm.logorganizer.sqs;

import com.pm.logorganizer.batch.FailureReason;
import com.pm.logorganizer.batch.RecordFailure;
import com.pm.logorganizer.record.DataRecord;
import com.pm.logorganizer.record.RecordValidator;
import com.pm.logorganizer.util.QueueUrls;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.Json;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Decodes and validates delivered messages, one at a time.
 */
public class SqsRecordParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(SqsRecordParser.class);

    private final RecordValidator validator;

    public SqsRecordParser(RecordValidator validator) {
        this.validator = validator;
    }

    /**
     * Outcome of parsing a single message: either a record ready for grouping or a failure.
     */
    public static class ParseResult {
        private final SqsParsedRecord record;
        private final RecordFailure failure;

        private ParseResult(SqsParsedRecord record, RecordFailure failure) {
            this.record = record;
            this.failure = failure;
        }

        public static ParseResult parsed(SqsParsedRecord record) {
            return new ParseResult(record, null);
        }

        public static ParseResult failed(RecordFailure failure) {
            return new ParseResult(null, failure);
        }

        public boolean isParsed() {
            return record != null;
        }

        public SqsParsedRecord getRecord() {
            return record;
        }

        public RecordFailure getFailure() {
            return failure;
        }
    }

    public ParseResult parse(SqsRawMessage message) {
        Object decoded;
        try {
            decoded = decodeBody(message.getBody());
        } catch (DecodeException e) {
            LOGGER.error("sqs_error: skipping record {} due to parsing failure: {}", message.getMessageId(), e.getMessage());
            return ParseResult.failed(new RecordFailure(message.getMessageId(), FailureReason.DECODE_ERROR,
                    "Failed to parse JSON body: " + e.getMessage()));
        }

        List<String> missingFields = validator.missingFields(decoded);
        LOGGER.debug("record {} missing fields: {}", message.getMessageId(), missingFields);
        if (!missingFields.isEmpty()) {
            String joined = String.join(", ", missingFields);
            LOGGER.error("sqs_error: skipping record {} due to missing mandatory fields [{}]", message.getMessageId(), joined);
            return ParseResult.failed(new RecordFailure(message.getMessageId(), FailureReason.VALIDATION_ERROR,
                    "Missing mandatory fields: " + joined));
        }

        JsonObject document = RecordValidator.asJsonObject(decoded);
        if (document == null) {
            LOGGER.error("sqs_error: skipping record {}, body is not a json object", message.getMessageId());
            return ParseResult.failed(new RecordFailure(message.getMessageId(), FailureReason.VALIDATION_ERROR,
                    "Record is not a JSON object"));
        }

        String queueUrl;
        try {
            queueUrl = QueueUrls.fromArn(message.getEventSourceArn());
        } catch (IllegalArgumentException e) {
            LOGGER.error("sqs_error: skipping record {}, cannot resolve queue url: {}", message.getMessageId(), e.getMessage());
            return ParseResult.failed(new RecordFailure(message.getMessageId(), FailureReason.DECODE_ERROR,
                    "Failed to resolve queue url: " + e.getMessage()));
        }

        DataRecord dataRecord = DataRecord.fromJson(document);
        return ParseResult.parsed(new SqsParsedRecord(dataRecord, message.getReceiptHandle(), message.getMessageId(), queueUrl));
    }

    private static Object decodeBody(String body) {
        if (body == null) {
            throw new DecodeException("message body is null");
        }
        return Json.decodeValue(body);
    }
}
