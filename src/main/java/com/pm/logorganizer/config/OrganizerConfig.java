package com.pm.logorganizer.config;

import com.pm.logorganizer.Const;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Settings every invocation needs: deployment stage, target bucket and key base path.
 *
 * Values are read from snake_case keys, falling back to the upper-case environment variable names.
 */
public class OrganizerConfig {
    private final String stage;
    private final String bucketName;
    private final String keyBasePath;

    public OrganizerConfig(String stage, String bucketName, String keyBasePath) {
        this.stage = stage;
        this.bucketName = bucketName;
        this.keyBasePath = keyBasePath;
    }

    public static OrganizerConfig fromJson(JsonObject config) {
        return new OrganizerConfig(
            read(config, Const.Config.StageProp),
            read(config, Const.Config.BucketNameProp),
            read(config, Const.Config.KeyBasePathProp));
    }

    private static String read(JsonObject config, String key) {
        Object value = config.getValue(key);
        if (value == null) {
            value = config.getValue(key.toUpperCase(Locale.ROOT));
        }
        return value == null ? null : value.toString();
    }

    /**
     * @throws ConfigurationException naming every missing setting
     */
    public void requireComplete() throws ConfigurationException {
        List<String> missing = new ArrayList<>();
        if (isBlank(stage)) missing.add(Const.Config.StageProp.toUpperCase(Locale.ROOT));
        if (isBlank(bucketName)) missing.add(Const.Config.BucketNameProp.toUpperCase(Locale.ROOT));
        if (isBlank(keyBasePath)) missing.add(Const.Config.KeyBasePathProp.toUpperCase(Locale.ROOT));

        if (!missing.isEmpty()) {
            throw new ConfigurationException("Missing required configuration: " + String.join(", ", missing));
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isEmpty();
    }

    public String getStage() {
        return stage;
    }

    public String getBucketName() {
        return bucketName;
    }

    public String getKeyBasePath() {
        return keyBasePath;
    }
}
