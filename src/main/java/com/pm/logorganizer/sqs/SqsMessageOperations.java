package com.pm.logorganizer.sqs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.Message;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageRequest;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageResponse;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Utility class for SQS receive operations used by the queue poller.
 */
public class SqsMessageOperations {
    private static final Logger LOGGER = LoggerFactory.getLogger(SqsMessageOperations.class);
    static final int SQS_MAX_RECEIVE_BATCH_SIZE = 10;

    private SqsMessageOperations() {
    }

    /**
     * Receives one batch from the queue and wraps the messages for the pipeline.
     *
     * @param sqsClient The SQS client
     * @param queueUrl The queue URL
     * @param queueArn The queue ARN, recorded on each message as its source
     * @param maxMessages Maximum number of messages to receive (capped at 10)
     * @param visibilityTimeout Visibility timeout in seconds
     * @return received messages, empty if the receive failed
     */
    public static List<SqsRawMessage> receiveBatch(
            SqsClient sqsClient,
            String queueUrl,
            String queueArn,
            int maxMessages,
            int visibilityTimeout) {

        try {
            ReceiveMessageRequest receiveRequest = ReceiveMessageRequest.builder()
                .queueUrl(queueUrl)
                .maxNumberOfMessages(Math.min(Math.max(maxMessages, 1), SQS_MAX_RECEIVE_BATCH_SIZE))
                .visibilityTimeout(visibilityTimeout)
                .waitTimeSeconds(0) // non-blocking poll
                .build();

            ReceiveMessageResponse response = sqsClient.receiveMessage(receiveRequest);
            List<Message> messages = response.messages();

            LOGGER.info("received {} messages", messages.size());
            return messages.stream()
                .map(message -> SqsRawMessage.fromSqsMessage(message, queueArn))
                .collect(Collectors.toList());

        } catch (Exception e) {
            LOGGER.error("sqs_error: failed to receive messages", e);
            return new ArrayList<>();
        }
    }
}
