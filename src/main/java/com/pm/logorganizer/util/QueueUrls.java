package com.pm.logorganizer.util;

/**
 * Resolves queue URLs from queue ARNs.
 */
public class QueueUrls {
    private QueueUrls() {
    }

    /**
     * {@code arn:aws:sqs:eu-west-1:123456789012:audit-logs} becomes
     * {@code https://sqs.eu-west-1.amazonaws.com/123456789012/audit-logs}.
     *
     * @throws IllegalArgumentException if the ARN does not have the expected six parts
     */
    public static String fromArn(String arn) {
        if (arn == null) {
            throw new IllegalArgumentException("queue arn is null");
        }
        String[] parts = arn.split(":", -1);
        if (parts.length < 6) {
            throw new IllegalArgumentException("malformed queue arn: " + arn);
        }
        String service = parts[2];
        String region = parts[3];
        String accountId = parts[4];
        String queueName = parts[5];
        return String.format("https://%s.%s.amazonaws.com/%s/%s", service, region, accountId, queueName);
    }
}
