package com.pm.logorganizer.partition;

import com.pm.logorganizer.record.DataRecord;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.Year;
import java.time.YearMonth;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Derives the hive-style partition key of a record, e.g.
 * <pre>
 * env=dev/message_type=audit_record/project_code=intel/partner=p/customer=c/client_id=undefined/
 * hashed_api_key=undefined/region=eu/country=it/component=ip-intel/year=2025/month=05/day=17/hour=19
 * </pre>
 *
 * Every segment is always rendered. An absent attribute renders as {@value #UNDEFINED_VALUE} so
 * that existing partitions in the bucket keep their layout. Values are used verbatim.
 */
public class PartitionKeyDeriver {
    static final String UNDEFINED_VALUE = "undefined";
    // calendar segments of a record whose dateTime is absent or cannot be parsed
    static final String UNPARSEABLE_TIME_VALUE = "NaN";

    // widest instant an ECMAScript Date can hold
    private static final double MAX_EPOCH_MILLIS = 8.64e15;
    private static final Pattern YEAR_ONLY = Pattern.compile("\\d{4}");
    private static final Pattern YEAR_MONTH = Pattern.compile("\\d{4}-\\d{2}");
    private static final Pattern DIGITS_ONLY = Pattern.compile("-?\\d+");
    private static final DateTimeFormatter ISO_DATE_TIME = new DateTimeFormatterBuilder()
        .parseCaseInsensitive()
        .append(DateTimeFormatter.ISO_LOCAL_DATE)
        .appendPattern("[' ']['T']")
        .append(DateTimeFormatter.ISO_LOCAL_TIME)
        .optionalStart().appendOffset("+HH:MM", "Z").optionalEnd()
        .optionalStart().appendOffset("+HHMM", "Z").optionalEnd()
        .optionalStart().appendOffset("+HH", "Z").optionalEnd()
        .toFormatter();

    private final HashedApiKeyCache apiKeyCache;

    public PartitionKeyDeriver(HashedApiKeyCache apiKeyCache) {
        this.apiKeyCache = apiKeyCache;
    }

    public String derive(DataRecord record) {
        List<String> segments = new ArrayList<>(13);
        segments.add(segment("message_type", record.getMessageType()));
        segments.add(segment("project_code", record.getProjectCode()));
        segments.add(segment("partner", record.getPartner()));
        segments.add(segment("customer", record.getCustomer()));
        segments.add(segment("client_id", record.getClientId()));
        segments.add(segment("hashed_api_key", apiKeyCache.hash(record.getApiKeyId())));
        segments.add(segment("region", record.getRegion()));
        segments.add(segment("country", record.getCountry()));
        segments.add(segment("component", record.getComponent()));

        ZonedDateTime timestamp = parseTimestamp(record.getDateTimeValue());
        if (timestamp != null) {
            segments.add("year=" + timestamp.getYear());
            segments.add("month=" + twoDigits(timestamp.getMonthValue()));
            segments.add("day=" + twoDigits(timestamp.getDayOfMonth()));
            segments.add("hour=" + twoDigits(timestamp.getHour()));
        } else {
            segments.add("year=" + UNPARSEABLE_TIME_VALUE);
            segments.add("month=" + UNPARSEABLE_TIME_VALUE);
            segments.add("day=" + UNPARSEABLE_TIME_VALUE);
            segments.add("hour=" + UNPARSEABLE_TIME_VALUE);
        }

        String key = String.join("/", segments);
        if (record.hasEnv()) {
            key = "env=" + record.getEnv() + "/" + key;
        }
        return key;
    }

    private static String segment(String name, String value) {
        return name + "=" + (value == null ? UNDEFINED_VALUE : value);
    }

    private static String twoDigits(int value) {
        return value < 10 ? "0" + value : String.valueOf(value);
    }

    /**
     * Parses the event timestamp into UTC.
     *
     * <ul>
     *   <li>numbers are epoch milliseconds, fractions truncated</li>
     *   <li>a four-digit string is a year, longer digit strings are epoch milliseconds</li>
     *   <li>ISO-8601 dates, year-months and date-times with {@code T} or a space before the time,
     *   offsets as {@code Z}, {@code +HH:MM}, {@code +HHMM} or {@code +HH}; no offset means UTC</li>
     *   <li>RFC 1123, e.g. {@code Sat, 17 May 2025 19:05:00 GMT}</li>
     * </ul>
     *
     * @param value the decoded timestamp attribute
     * @return the timestamp in UTC, or null when absent or unparseable
     */
    static ZonedDateTime parseTimestamp(Object value) {
        if (value instanceof Number) {
            return fromEpochMillis(((Number) value).doubleValue());
        }
        if (!(value instanceof String)) {
            return null;
        }

        String text = ((String) value).trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            if (YEAR_ONLY.matcher(text).matches()) {
                return Year.parse(text).atDay(1).atStartOfDay(ZoneOffset.UTC);
            }
            if (DIGITS_ONLY.matcher(text).matches()) {
                return Instant.ofEpochMilli(Long.parseLong(text)).atZone(ZoneOffset.UTC);
            }
        } catch (DateTimeException | NumberFormatException e) {
            return null;
        }

        ZonedDateTime parsed = parseIso(text);
        return parsed != null ? parsed : parseRfc1123(text);
    }

    private static ZonedDateTime fromEpochMillis(double millis) {
        if (Double.isNaN(millis) || Math.abs(millis) > MAX_EPOCH_MILLIS) {
            return null;
        }
        return Instant.ofEpochMilli((long) millis).atZone(ZoneOffset.UTC);
    }

    private static ZonedDateTime parseIso(String text) {
        try {
            if (text.indexOf('T') < 0 && text.indexOf(' ') < 0) {
                if (YEAR_MONTH.matcher(text).matches()) {
                    return YearMonth.parse(text).atDay(1).atStartOfDay(ZoneOffset.UTC);
                }
                return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC);
            }
            TemporalAccessor parsed = ISO_DATE_TIME.parseBest(text, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime) {
                return ((OffsetDateTime) parsed).atZoneSameInstant(ZoneOffset.UTC);
            }
            return ((LocalDateTime) parsed).atZone(ZoneOffset.UTC);
        } catch (DateTimeException e) {
            return null;
        }
    }

    private static ZonedDateTime parseRfc1123(String text) {
        try {
            return ZonedDateTime.parse(text, DateTimeFormatter.RFC_1123_DATE_TIME).withZoneSameInstant(ZoneOffset.UTC);
        } catch (DateTimeException e) {
            return null;
        }
    }
}
