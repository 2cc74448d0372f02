package com.pm.logorganizer.partition;

import com.pm.logorganizer.record.DataRecord;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.ZonedDateTime;

import static org.junit.jupiter.api.Assertions.*;

public class PartitionKeyDeriverTest {

    private static final String ABC_SHA256 = "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad";

    private PartitionKeyDeriver deriver;

    @BeforeEach
    void setUp() {
        deriver = new PartitionKeyDeriver(new HashedApiKeyCache());
    }

    private JsonObject fullRecord() {
        return new JsonObject()
            .put("messageType", "audit_record")
            .put("projectCode", "intel")
            .put("partner", "test-partner")
            .put("customer", "test-customer")
            .put("clientId", "client-1")
            .put("apiKeyId", "abc")
            .put("region", "eu")
            .put("country", "it")
            .put("component", "test-ip-intel")
            .put("dateTime", "2025-05-17T09:50:16.306Z");
    }

    @Test
    void testDerive_allAttributes() {
        String key = deriver.derive(DataRecord.fromJson(fullRecord()));

        assertEquals("message_type=audit_record/project_code=intel/partner=test-partner/customer=test-customer"
            + "/client_id=client-1/hashed_api_key=" + ABC_SHA256 + "/region=eu/country=it/component=test-ip-intel"
            + "/year=2025/month=05/day=17/hour=09", key);
    }

    @Test
    void testDerive_envIsPrepended() {
        String key = deriver.derive(DataRecord.fromJson(fullRecord().put("env", "dev")));

        assertTrue(key.startsWith("env=dev/message_type=audit_record/"));
    }

    @Test
    void testDerive_absentAttributesRenderedAsUndefined() {
        JsonObject record = new JsonObject()
            .put("messageType", "audit_record")
            .put("projectCode", "intel")
            .put("component", "c")
            .put("dateTime", "2025-01-02T03:04:05Z");

        String key = deriver.derive(DataRecord.fromJson(record));

        assertEquals("message_type=audit_record/project_code=intel/partner=undefined/customer=undefined"
            + "/client_id=undefined/hashed_api_key=undefined/region=undefined/country=undefined/component=c"
            + "/year=2025/month=01/day=02/hour=03", key);
    }

    @Test
    void testDerive_emptyAttributeKeepsItsSegment() {
        String key = deriver.derive(DataRecord.fromJson(fullRecord().put("region", "")));

        assertTrue(key.contains("/region=/country=it/"));
    }

    @Test
    void testDerive_valuesUsedVerbatim() {
        String key = deriver.derive(DataRecord.fromJson(fullRecord().put("customer", "ACME Corp")));

        assertTrue(key.contains("/customer=ACME Corp/"));
    }

    @Test
    void testDerive_timestampConvertedToUtc() {
        String key = deriver.derive(DataRecord.fromJson(fullRecord().put("dateTime", "2025-12-31T23:30:00-02:00")));

        assertTrue(key.endsWith("/year=2026/month=01/day=01/hour=01"));
    }

    @Test
    void testDerive_unparseableTimestamp() {
        String key = deriver.derive(DataRecord.fromJson(fullRecord().put("dateTime", "not a date")));

        assertTrue(key.endsWith("/year=NaN/month=NaN/day=NaN/hour=NaN"));
    }

    @Test
    void testDerive_isDeterministic() {
        DataRecord record = DataRecord.fromJson(fullRecord());

        assertEquals(deriver.derive(record), deriver.derive(record));
        assertEquals(deriver.derive(record), new PartitionKeyDeriver(new HashedApiKeyCache()).derive(record));
    }

    @Test
    void testDerive_sameHourSameKey_differentHourDifferentKey() {
        String a = deriver.derive(DataRecord.fromJson(fullRecord().put("dateTime", "2025-05-17T19:00:00Z")));
        String b = deriver.derive(DataRecord.fromJson(fullRecord().put("dateTime", "2025-05-17T19:59:59.999Z")));
        String c = deriver.derive(DataRecord.fromJson(fullRecord().put("dateTime", "2025-05-17T20:00:00Z")));

        assertEquals(a, b);
        assertNotEquals(b, c);
    }

    @Test
    void testParseTimestamp_supportedFormats() {
        ZonedDateTime epochMillis = PartitionKeyDeriver.parseTimestamp("1747511416306");
        assertEquals(2025, epochMillis.getYear());
        assertEquals(19, epochMillis.getHour());

        ZonedDateTime dateOnly = PartitionKeyDeriver.parseTimestamp("2025-05-17");
        assertEquals(0, dateOnly.getHour());
        assertEquals(17, dateOnly.getDayOfMonth());

        ZonedDateTime local = PartitionKeyDeriver.parseTimestamp("2025-05-17T08:15:00");
        assertEquals(8, local.getHour());

        assertNull(PartitionKeyDeriver.parseTimestamp(null));
        assertNull(PartitionKeyDeriver.parseTimestamp(""));
        assertNull(PartitionKeyDeriver.parseTimestamp("2025-13-40T00:00:00Z"));
    }

    private String timeSegments(Object dateTime) {
        String key = deriver.derive(DataRecord.fromJson(fullRecord().put("dateTime", dateTime)));
        return key.substring(key.indexOf("/year="));
    }

    @Test
    void testDerive_spaceSeparatedTimestamp() {
        assertEquals("/year=2025/month=05/day=17/hour=19", timeSegments("2025-05-17 19:05:00"));
    }

    @Test
    void testDerive_compactOffsetTimestamp() {
        assertEquals("/year=2025/month=05/day=17/hour=17", timeSegments("2025-05-17T19:05:00+0200"));
        assertEquals("/year=2025/month=05/day=17/hour=21", timeSegments("2025-05-17 19:05:00-02"));
    }

    @Test
    void testDerive_rfc1123Timestamp() {
        assertEquals("/year=2025/month=05/day=17/hour=19", timeSegments("Sat, 17 May 2025 19:05:00 GMT"));
    }

    @Test
    void testDerive_yearOnlyTimestamp() {
        assertEquals("/year=2025/month=01/day=01/hour=00", timeSegments("2025"));
        assertEquals("/year=2025/month=05/day=01/hour=00", timeSegments("2025-05"));
    }

    @Test
    void testDerive_numericTimestampIsEpochMillis() {
        assertEquals("/year=2025/month=05/day=17/hour=19", timeSegments(1747511416306L));
        assertEquals("/year=2025/month=05/day=17/hour=19", timeSegments(1747511416306.5));
        assertEquals("/year=NaN/month=NaN/day=NaN/hour=NaN", timeSegments(9.0e15));
    }

    @Test
    void testDerive_nonTextTimestamp() {
        assertEquals("/year=NaN/month=NaN/day=NaN/hour=NaN", timeSegments(new JsonObject().put("at", 1)));
        assertEquals("/year=NaN/month=NaN/day=NaN/hour=NaN", timeSegments(true));
    }

    @Test
    void testDerive_falsyApiKeyIdTreatedAsAbsent() {
        String zero = deriver.derive(DataRecord.fromJson(fullRecord().put("apiKeyId", 0)));
        String falseKey = deriver.derive(DataRecord.fromJson(fullRecord().put("apiKeyId", false)));
        String empty = deriver.derive(DataRecord.fromJson(fullRecord().put("apiKeyId", "")));

        assertTrue(zero.contains("/hashed_api_key=undefined/"));
        assertTrue(falseKey.contains("/hashed_api_key=undefined/"));
        assertTrue(empty.contains("/hashed_api_key=undefined/"));
    }

    @Test
    void testDerive_numericApiKeyIdIsHashed() {
        HashedApiKeyCache cache = new HashedApiKeyCache();
        String key = new PartitionKeyDeriver(cache).derive(DataRecord.fromJson(fullRecord().put("apiKeyId", 42)));

        assertTrue(key.contains("/hashed_api_key=" + cache.hash("42") + "/"));
    }
}
