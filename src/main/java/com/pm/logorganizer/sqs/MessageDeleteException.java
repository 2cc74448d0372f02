package com.pm.logorganizer.sqs;

import java.io.IOException;

public class MessageDeleteException extends IOException {
    private final String queueUrl;
    private final String receiptHandle;
    private final String messageId;

    public MessageDeleteException(String queueUrl, String receiptHandle, String messageId, Throwable cause) {
        super(String.format("Error in deleting the message from sqs queue %s with receipt handle: %s, message Id: %s",
            queueUrl, receiptHandle, messageId), cause);
        this.queueUrl = queueUrl;
        this.receiptHandle = receiptHandle;
        this.messageId = messageId;
    }

    public String getQueueUrl() {
        return queueUrl;
    }

    public String getReceiptHandle() {
        return receiptHandle;
    }

    public String getMessageId() {
        return messageId;
    }
}
