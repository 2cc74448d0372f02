package com.pm.logorganizer.sqs;

import software.amazon.awssdk.services.sqs.model.Message;

/**
 * A message delivered by the queue: body text plus what is needed to delete it afterwards.
 */
public class SqsRawMessage {
    private final String messageId;
    private final String receiptHandle;
    private final String body;
    private final String eventSourceArn;

    public SqsRawMessage(String messageId, String receiptHandle, String body, String eventSourceArn) {
        this.messageId = messageId;
        this.receiptHandle = receiptHandle;
        this.body = body;
        this.eventSourceArn = eventSourceArn;
    }

    /**
     * Wraps a message received by polling the queue identified by {@code queueArn}.
     */
    public static SqsRawMessage fromSqsMessage(Message message, String queueArn) {
        return new SqsRawMessage(message.messageId(), message.receiptHandle(), message.body(), queueArn);
    }

    public String getMessageId() {
        return messageId;
    }

    public String getReceiptHandle() {
        return receiptHandle;
    }

    public String getBody() {
        return body;
    }

    public String getEventSourceArn() {
        return eventSourceArn;
    }
}
