package com.pm.logorganizer.storage;

import com.google.common.base.Stopwatch;
import com.pm.logorganizer.partition.PartitionGroup;
import com.pm.logorganizer.record.DataRecord;
import com.pm.logorganizer.retry.RetryingCall;
import com.pm.logorganizer.retry.TooManyRetriesException;
import com.pm.logorganizer.sqs.SqsParsedRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.nio.charset.StandardCharsets;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Writes a partition group to S3 as a single newline-delimited JSON object.
 *
 * <p>Objects land at {@code <basePath>/<partitionKey>/<uuid>.json}. The random suffix keeps
 * concurrent invocations writing to the same partition from colliding, so nothing is ever
 * overwritten. A group is written whole or not at all.</p>
 */
public class PartitionGroupWriter {
    private static final Logger LOGGER = LoggerFactory.getLogger(PartitionGroupWriter.class);
    public static final String CONTENT_TYPE = "application/x-ndjson";

    private final S3Client s3Client;
    private final String keyBasePath;
    private final RetryingCall retryingCall;
    private final Supplier<UUID> uuidSupplier;

    public PartitionGroupWriter(S3Client s3Client, String keyBasePath, RetryingCall retryingCall) {
        this(s3Client, keyBasePath, retryingCall, UUID::randomUUID);
    }

    public PartitionGroupWriter(S3Client s3Client, String keyBasePath, RetryingCall retryingCall, Supplier<UUID> uuidSupplier) {
        this.s3Client = s3Client;
        this.keyBasePath = keyBasePath;
        this.retryingCall = retryingCall;
        this.uuidSupplier = uuidSupplier;
    }

    /**
     * @param bucketName target bucket
     * @param group records to persist, written in group order
     * @return the object key written
     * @throws PartitionWriteException if the put still fails after retries
     */
    public String write(String bucketName, PartitionGroup group) throws PartitionWriteException {
        String key = objectKey(group.getKey(), uuidSupplier.get());
        byte[] body = encode(group).getBytes(StandardCharsets.UTF_8);

        PutObjectRequest request = PutObjectRequest.builder()
            .bucket(bucketName)
            .key(key)
            .contentType(CONTENT_TYPE)
            .build();

        final Stopwatch sw = Stopwatch.createStarted();
        try {
            retryingCall.run(() -> s3Client.putObject(request, RequestBody.fromBytes(body)));
        } catch (TooManyRetriesException e) {
            LOGGER.error("s3_error: failed to save record group to s3 with key {}: {}", group.getKey(), e.getMessage());
            throw new PartitionWriteException(group.getKey(), e);
        }

        LOGGER.debug("saved {} records to s3 in jsonl format: {}/{} ({} bytes, {}ms)",
            group.size(), bucketName, key, body.length, sw.elapsed(TimeUnit.MILLISECONDS));
        return key;
    }

    String objectKey(String partitionKey, UUID uuid) {
        return keyBasePath + "/" + partitionKey + "/" + uuid + ".json";
    }

    /**
     * One JSON document per line, no trailing newline.
     */
    static String encode(PartitionGroup group) {
        return group.getRecords().stream()
            .map(SqsParsedRecord::getDataRecord)
            .map(DataRecord::encode)
            .collect(Collectors.joining("\n"));
    }
}
