package com.pm.logorganizer.storage;

import java.io.IOException;

public class PartitionWriteException extends IOException {
    private final String partitionKey;

    public PartitionWriteException(String partitionKey, Throwable cause) {
        super("Failed to save record group to S3 with key " + partitionKey, cause);
        this.partitionKey = partitionKey;
    }

    public String getPartitionKey() {
        return partitionKey;
    }
}
