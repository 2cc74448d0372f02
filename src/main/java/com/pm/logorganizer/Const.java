package com.pm.logorganizer;

public class Const {
    public static class Config {
        public static final String VERTX_CONFIG_PATH_PROP = "vertx-config-path";
        public static final String LOCAL_CONFIG_PATH = "conf/local-config.json";
        public static final String OVERRIDE_CONFIG_PATH = "conf/config.json";

        public static final String StageProp = "stage";
        public static final String BucketNameProp = "pm_bucket_name";
        public static final String KeyBasePathProp = "s3_key_base_path";
        public static final String RetryProp = "retry";
        public static final String ServicePortProp = "service_port";
        public static final String SqsQueueArnProp = "sqs_queue_arn";
        public static final String SqsPollEnabledProp = "sqs_poll_enabled";
        public static final String SqsPollIntervalSecondsProp = "sqs_poll_interval_seconds";
        public static final String SqsMaxMessagesPerPollProp = "sqs_max_messages_per_poll";
        public static final String SqsVisibilityTimeoutProp = "sqs_visibility_timeout_seconds";
        public static final String AwsRegionProp = "aws_region";
        public static final String S3EndpointProp = "s3_endpoint";
        public static final String SqsEndpointProp = "sqs_endpoint";
    }

    public static class Event {
        public static final String BatchPoll = "batch.poll";
    }

    public static class Port {
        public static final int ServicePort = 8080;
        public static final int PrometheusPort = 9080;
    }
}
