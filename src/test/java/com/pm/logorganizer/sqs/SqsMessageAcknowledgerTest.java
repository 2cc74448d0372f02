package com.pm.logorganizer.sqs;

import com.pm.logorganizer.config.RetryPolicy;
import com.pm.logorganizer.record.DataRecord;
import com.pm.logorganizer.retry.RetryingCall;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.DeleteMessageRequest;
import software.amazon.awssdk.services.sqs.model.DeleteMessageResponse;
import software.amazon.awssdk.services.sqs.model.SqsException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class SqsMessageAcknowledgerTest {

    private static final String QUEUE_URL = "https://sqs.eu-west-1.amazonaws.com/123456789012/audit-logs";

    private SqsClient mockSqsClient;
    private SqsParsedRecord record;

    @BeforeEach
    void setUp() {
        mockSqsClient = mock(SqsClient.class);
        record = new SqsParsedRecord(DataRecord.fromJson(new JsonObject().put("messageType", "audit_record")),
            "receipt-1", "msg-1", QUEUE_URL);
    }

    private SqsMessageAcknowledger acknowledger(int maxAttempts) {
        RetryingCall retryingCall = new RetryingCall("sqs_delete",
            new RetryPolicy(null, null, null, maxAttempts, false), millis -> { }, () -> 0.0);
        return new SqsMessageAcknowledger(mockSqsClient, retryingCall);
    }

    @Test
    void testAcknowledge_deletesByReceiptHandle() throws MessageDeleteException {
        when(mockSqsClient.deleteMessage(any(DeleteMessageRequest.class))).thenReturn(DeleteMessageResponse.builder().build());

        acknowledger(1).acknowledge(record);

        ArgumentCaptor<DeleteMessageRequest> captor = ArgumentCaptor.forClass(DeleteMessageRequest.class);
        verify(mockSqsClient, times(1)).deleteMessage(captor.capture());
        assertEquals(QUEUE_URL, captor.getValue().queueUrl());
        assertEquals("receipt-1", captor.getValue().receiptHandle());
    }

    @Test
    void testAcknowledge_transientFailureRetried() throws MessageDeleteException {
        when(mockSqsClient.deleteMessage(any(DeleteMessageRequest.class)))
            .thenThrow(SqsException.builder().message("throttled").build())
            .thenReturn(DeleteMessageResponse.builder().build());

        acknowledger(3).acknowledge(record);

        verify(mockSqsClient, times(2)).deleteMessage(any(DeleteMessageRequest.class));
    }

    @Test
    void testAcknowledge_retriesExhausted() {
        when(mockSqsClient.deleteMessage(any(DeleteMessageRequest.class)))
            .thenThrow(SqsException.builder().message("receipt handle expired").build());

        MessageDeleteException e = assertThrows(MessageDeleteException.class, () -> acknowledger(2).acknowledge(record));

        verify(mockSqsClient, times(2)).deleteMessage(any(DeleteMessageRequest.class));
        assertEquals("msg-1", e.getMessageId());
        assertEquals("Error in deleting the message from sqs queue " + QUEUE_URL
            + " with receipt handle: receipt-1, message Id: msg-1", e.getMessage());
    }
}
