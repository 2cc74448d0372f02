package com.pm.logorganizer.partition;

import com.pm.logorganizer.sqs.SqsParsedRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Buckets records by partition key in a single pass.
 * Groups come out in first-sighting order of their key; records keep input order within a group.
 */
public class PartitionGrouper {
    private static final Logger LOGGER = LoggerFactory.getLogger(PartitionGrouper.class);

    private final PartitionKeyDeriver keyDeriver;

    public PartitionGrouper(PartitionKeyDeriver keyDeriver) {
        this.keyDeriver = keyDeriver;
    }

    public List<PartitionGroup> group(List<SqsParsedRecord> records) {
        Map<String, PartitionGroup> groups = new LinkedHashMap<>();

        for (SqsParsedRecord record : records) {
            String key = keyDeriver.derive(record.getDataRecord());
            groups.computeIfAbsent(key, PartitionGroup::new).add(record);
        }

        LOGGER.debug("grouped {} records into {} partitions", records.size(), groups.size());
        return new ArrayList<>(groups.values());
    }
}
