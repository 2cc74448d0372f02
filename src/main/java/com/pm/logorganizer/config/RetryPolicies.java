package com.pm.logorganizer.config;

import com.pm.logorganizer.Const;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Retry policy per call site, built once at startup from the {@code retry} config object:
 * <pre>
 * "retry": {
 *   "default":    { "delay_ms": 200, "max_attempts": 3, "jitter": true },
 *   "sqs_delete": { "delay_ms": 100, "min_delay_ms": 50, "max_delay_ms": 500, "max_attempts": 5 }
 * }
 * </pre>
 * Call sites without an entry use {@code default}.
 */
public class RetryPolicies {
    private static final Logger LOGGER = LoggerFactory.getLogger(RetryPolicies.class);

    public static final String DEFAULT = "default";
    public static final String S3_PUT = "s3_put";
    public static final String SQS_DELETE = "sqs_delete";

    private final Map<String, RetryPolicy> policies;

    public RetryPolicies(Map<String, RetryPolicy> policies) {
        this.policies = Collections.unmodifiableMap(new HashMap<>(policies));
    }

    public static RetryPolicies singleAttempt() {
        return new RetryPolicies(Map.of());
    }

    public static RetryPolicies fromConfig(JsonObject config) throws ConfigurationException {
        JsonObject retry = config.getJsonObject(Const.Config.RetryProp);
        Map<String, RetryPolicy> policies = new HashMap<>();
        if (retry == null) {
            LOGGER.warn("no retry configuration found, every call gets a single attempt");
            return new RetryPolicies(policies);
        }

        for (String callSite : retry.fieldNames()) {
            Object value = retry.getValue(callSite);
            if (!(value instanceof JsonObject)) {
                throw new ConfigurationException("retry." + callSite + " must be an object");
            }
            RetryPolicy policy = parsePolicy(callSite, (JsonObject) value);
            LOGGER.info("retry policy for {}: {}", callSite, policy);
            policies.put(callSite, policy);
        }
        return new RetryPolicies(policies);
    }

    public RetryPolicy forCallSite(String callSite) {
        RetryPolicy policy = policies.get(callSite);
        if (policy != null) {
            return policy;
        }
        return policies.getOrDefault(DEFAULT, RetryPolicy.SINGLE_ATTEMPT);
    }

    private static RetryPolicy parsePolicy(String callSite, JsonObject json) throws ConfigurationException {
        Long delay = readNonNegative(callSite, json, "delay_ms");
        Long minDelay = readNonNegative(callSite, json, "min_delay_ms");
        Long maxDelay = readNonNegative(callSite, json, "max_delay_ms");
        Long maxAttempts = readNonNegative(callSite, json, "max_attempts");
        if (maxAttempts != null && (maxAttempts < 1 || maxAttempts > Integer.MAX_VALUE)) {
            throw new ConfigurationException("retry." + callSite + ".max_attempts must be at least 1");
        }
        if (minDelay != null && maxDelay != null && minDelay > maxDelay) {
            throw new ConfigurationException("retry." + callSite + ".min_delay_ms exceeds max_delay_ms");
        }

        Object jitter = json.getValue("jitter");
        boolean isJitter = Boolean.TRUE.equals(jitter) || "true".equals(jitter);

        return new RetryPolicy(delay, minDelay, maxDelay, maxAttempts == null ? null : maxAttempts.intValue(), isJitter);
    }

    private static Long readNonNegative(String callSite, JsonObject json, String name) throws ConfigurationException {
        Object value = json.getValue(name);
        if (value == null) {
            return null;
        }

        long parsed;
        if (value instanceof Number) {
            parsed = ((Number) value).longValue();
        } else {
            try {
                parsed = Long.parseLong(value.toString().trim());
            } catch (NumberFormatException e) {
                throw new ConfigurationException("retry." + callSite + "." + name + " is not a number: " + value);
            }
        }

        if (parsed < 0) {
            throw new ConfigurationException("retry." + callSite + "." + name + " must not be negative");
        }
        return parsed;
    }
}
