package com.pm.logorganizer.batch;

import com.pm.logorganizer.config.ConfigurationException;
import com.pm.logorganizer.config.OrganizerConfig;
import com.pm.logorganizer.partition.PartitionGroup;
import com.pm.logorganizer.partition.PartitionGrouper;
import com.pm.logorganizer.sqs.MessageDeleteException;
import com.pm.logorganizer.sqs.SqsMessageAcknowledger;
import com.pm.logorganizer.sqs.SqsParsedRecord;
import com.pm.logorganizer.sqs.SqsRawMessage;
import com.pm.logorganizer.sqs.SqsRecordParser;
import com.pm.logorganizer.storage.PartitionGroupWriter;
import com.pm.logorganizer.storage.PartitionWriteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs one delivered batch through the pipeline.
 *
 * <ul>
 *   <li>Decoding and validating each message, pairing valid records with their deletion details</li>
 *   <li>Grouping records by partition key</li>
 *   <li>Writing each group to S3 as one newline-delimited JSON object</li>
 *   <li>Deleting each group member's message, only after the group write succeeded</li>
 * </ul>
 *
 * <p>Failures are isolated per record (decode, validation, delete) or per group (write) and
 * recorded in the {@link BatchOutcome}; the rest of the batch carries on. A group whose write
 * fails has none of its messages deleted, so the queue redelivers them.</p>
 */
public class BatchOrchestrator {
    private static final Logger LOGGER = LoggerFactory.getLogger(BatchOrchestrator.class);

    private final OrganizerConfig config;
    private final SqsRecordParser parser;
    private final PartitionGrouper grouper;
    private final PartitionGroupWriter writer;
    private final SqsMessageAcknowledger acknowledger;
    private final BatchMetrics metrics;

    public BatchOrchestrator(
            OrganizerConfig config,
            SqsRecordParser parser,
            PartitionGrouper grouper,
            PartitionGroupWriter writer,
            SqsMessageAcknowledger acknowledger,
            BatchMetrics metrics) {
        this.config = config;
        this.parser = parser;
        this.grouper = grouper;
        this.writer = writer;
        this.acknowledger = acknowledger;
        this.metrics = metrics;
    }

    /**
     * Processes a batch to completion.
     *
     * @param messages delivered messages, in delivery order
     * @return counts and per-record failures; returned even when some records failed
     * @throws ConfigurationException if required configuration is missing; nothing is processed then
     */
    public BatchOutcome processBatch(List<SqsRawMessage> messages) throws ConfigurationException {
        config.requireComplete();

        LOGGER.debug("received batch of {} messages", messages.size());
        BatchOutcome.Builder outcome = BatchOutcome.builder(messages.size());

        // decode + validate
        List<SqsParsedRecord> parsedRecords = new ArrayList<>();
        for (SqsRawMessage message : messages) {
            SqsRecordParser.ParseResult result = parser.parse(message);
            if (result.isParsed()) {
                parsedRecords.add(result.getRecord());
            } else {
                recordFailure(outcome, result.getFailure());
            }
        }

        List<PartitionGroup> groups = grouper.group(parsedRecords);
        for (PartitionGroup group : groups) {
            processGroup(group, outcome);
        }

        BatchOutcome result = outcome.build();
        LOGGER.info("processed batch: total={}, succeeded={}, failed={}, groups={}",
            result.getTotalRecords(), result.getSuccessfulRecords(), result.getFailedRecords(), result.getGroupsProcessed());
        return result;
    }

    private void processGroup(PartitionGroup group, BatchOutcome.Builder outcome) {
        String storageKey;
        try {
            storageKey = writer.write(config.getBucketName(), group);
        } catch (PartitionWriteException e) {
            LOGGER.error("s3_error: failed to process group {}: {}", group.getKey(), e.getMessage());
            for (SqsParsedRecord record : group.getRecords()) {
                recordFailure(outcome, new RecordFailure(record.getMessageId(), FailureReason.WRITE_ERROR, e.getMessage()));
            }
            return;
        }
        metrics.groupWritten();

        for (SqsParsedRecord record : group.getRecords()) {
            try {
                acknowledger.acknowledge(record);
                outcome.succeeded(record.getMessageId(), storageKey);
                metrics.recordSucceeded();
            } catch (MessageDeleteException e) {
                recordFailure(outcome, new RecordFailure(record.getMessageId(), FailureReason.ACKNOWLEDGE_ERROR, e.getMessage()));
            }
        }

        outcome.groupProcessed();
        LOGGER.info("stored group of {} records at {}", group.size(), storageKey);
    }

    private void recordFailure(BatchOutcome.Builder outcome, RecordFailure failure) {
        outcome.failed(failure);
        metrics.recordFailed(failure.getReason());
    }
}
