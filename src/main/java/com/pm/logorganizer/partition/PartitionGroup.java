package com.pm.logorganizer.partition;

import com.pm.logorganizer.sqs.SqsParsedRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Records sharing one partition key, in arrival order.
 */
public class PartitionGroup {
    private final String key;
    private final List<SqsParsedRecord> records = new ArrayList<>();

    public PartitionGroup(String key) {
        this.key = key;
    }

    void add(SqsParsedRecord record) {
        records.add(record);
    }

    public String getKey() {
        return key;
    }

    public List<SqsParsedRecord> getRecords() {
        return Collections.unmodifiableList(records);
    }

    public int size() {
        return records.size();
    }
}
