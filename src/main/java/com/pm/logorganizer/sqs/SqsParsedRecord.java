package com.pm.logorganizer.sqs;

import com.pm.logorganizer.record.DataRecord;

/**
 * A validated record paired with the queue details needed to delete its message.
 */
public class SqsParsedRecord {
    private final DataRecord dataRecord;
    private final String receiptHandle;
    private final String messageId;
    private final String queueUrl;

    public SqsParsedRecord(DataRecord dataRecord, String receiptHandle, String messageId, String queueUrl) {
        this.dataRecord = dataRecord;
        this.receiptHandle = receiptHandle;
        this.messageId = messageId;
        this.queueUrl = queueUrl;
    }

    public DataRecord getDataRecord() {
        return dataRecord;
    }

    public String getReceiptHandle() {
        return receiptHandle;
    }

    public String getMessageId() {
        return messageId;
    }

    public String getQueueUrl() {
        return queueUrl;
    }
}
