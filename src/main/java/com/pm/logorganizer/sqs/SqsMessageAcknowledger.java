package com.pm.logorganizer.sqs;

import com.pm.logorganizer.retry.RetryingCall;
import com.pm.logorganizer.retry.TooManyRetriesException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.DeleteMessageRequest;

/**
 * Deletes the queue message behind a record. Only call this once the record's group is stored.
 */
public class SqsMessageAcknowledger {
    private static final Logger LOGGER = LoggerFactory.getLogger(SqsMessageAcknowledger.class);

    private final SqsClient sqsClient;
    private final RetryingCall retryingCall;

    public SqsMessageAcknowledger(SqsClient sqsClient, RetryingCall retryingCall) {
        this.sqsClient = sqsClient;
        this.retryingCall = retryingCall;
    }

    /**
     * @throws MessageDeleteException if the delete still fails after retries
     */
    public void acknowledge(SqsParsedRecord record) throws MessageDeleteException {
        String queueUrl = record.getQueueUrl();
        LOGGER.debug("deleting message from sqs queue {} with receipt handle: {}, message id: {}",
            queueUrl, record.getReceiptHandle(), record.getMessageId());

        DeleteMessageRequest request = DeleteMessageRequest.builder()
            .queueUrl(queueUrl)
            .receiptHandle(record.getReceiptHandle())
            .build();

        try {
            retryingCall.run(() -> sqsClient.deleteMessage(request));
        } catch (TooManyRetriesException e) {
            MessageDeleteException error = new MessageDeleteException(queueUrl, record.getReceiptHandle(), record.getMessageId(), e);
            LOGGER.error("sqs_error: {}: {}", error.getMessage(), e.getMessage());
            throw error;
        }

        LOGGER.debug("deleted message from sqs queue {} with receipt handle: {}, message id: {}",
            queueUrl, record.getReceiptHandle(), record.getMessageId());
    }
}
