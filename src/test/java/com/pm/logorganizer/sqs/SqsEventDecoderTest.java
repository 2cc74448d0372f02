package com.pm.logorganizer.sqs;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SqsEventDecoderTest {

    private static final String QUEUE_ARN = "arn:aws:sqs:eu-west-1:123456789012:audit-logs";

    @Test
    void testDecode_recordsInOrder() {
        // Setup
        JsonObject event = new JsonObject().put("Records", new JsonArray()
            .add(new JsonObject()
                .put("messageId", "m1")
                .put("receiptHandle", "r1")
                .put("eventSourceARN", QUEUE_ARN)
                .put("body", "{\"messageType\":\"audit_record\"}"))
            .add(new JsonObject()
                .put("messageId", "m2")
                .put("receiptHandle", "r2")
                .put("eventSourceARN", QUEUE_ARN)
                .put("body", "not json")));

        // Act
        List<SqsRawMessage> messages = SqsEventDecoder.decode(event);

        // Assert
        assertEquals(2, messages.size());
        assertEquals("m1", messages.get(0).getMessageId());
        assertEquals("r1", messages.get(0).getReceiptHandle());
        assertEquals(QUEUE_ARN, messages.get(0).getEventSourceArn());
        assertEquals("{\"messageType\":\"audit_record\"}", messages.get(0).getBody());
        assertEquals("not json", messages.get(1).getBody());
    }

    @Test
    void testDecode_emptyRecords() {
        assertTrue(SqsEventDecoder.decode(new JsonObject().put("Records", new JsonArray())).isEmpty());
    }

    @Test
    void testDecode_missingBodyIsKeptAsNull() {
        JsonObject event = new JsonObject().put("Records", new JsonArray()
            .add(new JsonObject().put("messageId", "m1").put("receiptHandle", "r1")));

        assertNull(SqsEventDecoder.decode(event).get(0).getBody());
    }

    @Test
    void testDecode_malformedEnvelope() {
        assertThrows(IllegalArgumentException.class, () -> SqsEventDecoder.decode(null));
        assertThrows(IllegalArgumentException.class, () -> SqsEventDecoder.decode(new JsonObject()));
        assertThrows(IllegalArgumentException.class, () -> SqsEventDecoder.decode(new JsonObject().put("Records", "x")));
        assertThrows(IllegalArgumentException.class, () -> SqsEventDecoder.decode(
            new JsonObject().put("Records", new JsonArray().add("not an object"))));
    }
}
