package com.pm.logorganizer;

import com.pm.logorganizer.batch.BatchMetrics;
import com.pm.logorganizer.batch.BatchOrchestrator;
import com.pm.logorganizer.config.ConfigurationException;
import com.pm.logorganizer.config.OrganizerConfig;
import com.pm.logorganizer.config.RetryPolicies;
import com.pm.logorganizer.partition.HashedApiKeyCache;
import com.pm.logorganizer.partition.PartitionGrouper;
import com.pm.logorganizer.partition.PartitionKeyDeriver;
import com.pm.logorganizer.record.RecordValidator;
import com.pm.logorganizer.retry.RetryingCall;
import com.pm.logorganizer.sqs.SqsMessageAcknowledger;
import com.pm.logorganizer.sqs.SqsRecordParser;
import com.pm.logorganizer.storage.PartitionGroupWriter;
import com.pm.logorganizer.vertx.Endpoints;
import com.pm.logorganizer.vertx.LogOrganizerVerticle;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.micrometer.prometheus.PrometheusRenameFilter;
import io.vertx.config.ConfigRetriever;
import io.vertx.config.ConfigRetrieverOptions;
import io.vertx.config.ConfigStoreOptions;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import io.vertx.core.http.HttpServerOptions;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.micrometer.Label;
import io.vertx.micrometer.MicrometerMetricsOptions;
import io.vertx.micrometer.VertxPrometheusOptions;
import io.vertx.micrometer.backends.BackendRegistries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.SqsClientBuilder;

import java.net.URI;
import java.util.EnumSet;
import java.util.Locale;

//
// produces events:
//   - batch.poll (timer-based, when sqs_poll_enabled)
//
public class Main {
    private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

    private final Vertx vertx;
    private final JsonObject config;
    private final SqsClient sqsClient;
    private final S3Client s3Client;

    public Main(Vertx vertx, JsonObject config) {
        this.vertx = vertx;
        this.config = config;
        this.sqsClient = createSqsClient(config);
        this.s3Client = createS3Client(config);
    }

    public static void main(String[] args) {
        final String vertxConfigPath = System.getProperty(Const.Config.VERTX_CONFIG_PATH_PROP);
        if (vertxConfigPath != null) {
            LOGGER.info("Running CUSTOM CONFIG mode, config: {}", vertxConfigPath);
        } else if (!isProductionEnvironment()) {
            LOGGER.info("Running LOCAL DEBUG mode, config: {}", Const.Config.LOCAL_CONFIG_PATH);
            System.setProperty(Const.Config.VERTX_CONFIG_PATH_PROP, Const.Config.LOCAL_CONFIG_PATH);
        } else {
            LOGGER.info("Running PRODUCTION mode, config: {}", Const.Config.OVERRIDE_CONFIG_PATH);
            System.setProperty(Const.Config.VERTX_CONFIG_PATH_PROP, Const.Config.OVERRIDE_CONFIG_PATH);
        }

        VertxPrometheusOptions prometheusOptions = new VertxPrometheusOptions()
            .setStartEmbeddedServer(true)
            .setEmbeddedServerOptions(new HttpServerOptions().setPort(Const.Port.PrometheusPort))
            .setEnabled(true);

        MicrometerMetricsOptions metricOptions = new MicrometerMetricsOptions()
            .setPrometheusOptions(prometheusOptions)
            .setLabels(EnumSet.of(Label.HTTP_METHOD, Label.HTTP_CODE, Label.HTTP_PATH))
            .setJvmMetricsEnabled(true)
            .setEnabled(true);
        setupMetrics(metricOptions);

        Vertx vertx = Vertx.vertx(new VertxOptions().setMetricsOptions(metricOptions));

        ConfigRetriever retriever = createConfigRetriever(vertx);
        retriever.getConfig(ar -> {
            if (ar.failed()) {
                LOGGER.error("Unable to read config: " + ar.cause().getMessage(), ar.cause());
                vertx.close();
                System.exit(1);
                return;
            }
            try {
                Main app = new Main(vertx, ar.result());
                app.run();
            } catch (Exception e) {
                LOGGER.error("Unable to create/run application: " + e.getMessage(), e);
                vertx.close();
                System.exit(1);
            }
        });
    }

    static ConfigRetriever createConfigRetriever(Vertx vertx) {
        ConfigStoreOptions fileStore = new ConfigStoreOptions()
            .setType("file")
            .setFormat("json")
            .setConfig(new JsonObject().put("path", System.getProperty(Const.Config.VERTX_CONFIG_PATH_PROP)));

        // the original deployment configured these through environment variables
        ConfigStoreOptions envStore = new ConfigStoreOptions()
            .setType("env")
            .setConfig(new JsonObject().put("keys", new JsonArray()
                .add(Const.Config.StageProp.toUpperCase(Locale.ROOT))
                .add(Const.Config.BucketNameProp.toUpperCase(Locale.ROOT))
                .add(Const.Config.KeyBasePathProp.toUpperCase(Locale.ROOT))));

        return ConfigRetriever.create(vertx, new ConfigRetrieverOptions()
            .addStore(fileStore)
            .addStore(envStore));
    }

    private static boolean isProductionEnvironment() {
        String env = System.getenv("DEPLOYMENT_ENVIRONMENT");
        return env != null && !env.isEmpty() && !"local".equalsIgnoreCase(env);
    }

    private static void setupMetrics(MicrometerMetricsOptions metricOptions) {
        BackendRegistries.setupBackend(metricOptions, null);

        if (BackendRegistries.getDefaultNow() instanceof PrometheusMeterRegistry) {
            PrometheusMeterRegistry prometheusRegistry = (PrometheusMeterRegistry) BackendRegistries.getDefaultNow();

            prometheusRegistry.config()
                .meterFilter(new PrometheusRenameFilter())
                .meterFilter(MeterFilter.deny(id ->
                    id.getName().startsWith("vertx.http.server") &&
                    id.getTag(Label.HTTP_PATH.toString()) != null &&
                    !Endpoints.pathSet().contains(id.getTag(Label.HTTP_PATH.toString()))))
                .commonTags("application", "pm-log-organizer");

            Metrics.addRegistry(prometheusRegistry);
        }
    }

    public void run() throws ConfigurationException {
        OrganizerConfig organizerConfig = OrganizerConfig.fromJson(config);
        try {
            organizerConfig.requireComplete();
        } catch (ConfigurationException e) {
            // every batch is refused until this is fixed
            LOGGER.error("config_error: {}", e.getMessage());
        }

        RetryPolicies retryPolicies = RetryPolicies.fromConfig(config);
        HashedApiKeyCache apiKeyCache = new HashedApiKeyCache();

        BatchOrchestrator orchestrator = new BatchOrchestrator(
            organizerConfig,
            new SqsRecordParser(new RecordValidator()),
            new PartitionGrouper(new PartitionKeyDeriver(apiKeyCache)),
            new PartitionGroupWriter(this.s3Client, organizerConfig.getKeyBasePath(),
                new RetryingCall(RetryPolicies.S3_PUT, retryPolicies.forCallSite(RetryPolicies.S3_PUT))),
            new SqsMessageAcknowledger(this.sqsClient,
                new RetryingCall(RetryPolicies.SQS_DELETE, retryPolicies.forCallSite(RetryPolicies.SQS_DELETE))),
            new BatchMetrics());

        LogOrganizerVerticle verticle = new LogOrganizerVerticle(config, orchestrator, this.sqsClient);
        vertx.deployVerticle(verticle)
            .onSuccess(id -> {
                LOGGER.info("Log organizer fully started (stage: {})...", organizerConfig.getStage());
                setupTimerEvents();
            })
            .onFailure(t -> {
                LOGGER.error("Unable to bootstrap log organizer", t);
                vertx.close();
                System.exit(1);
            });

        Runtime.getRuntime().addShutdownHook(new Thread(this::closeClients));
    }

    private void setupTimerEvents() {
        if (!config.getBoolean(Const.Config.SqsPollEnabledProp, false)) {
            LOGGER.info("sqs polling disabled, batches arrive via {}", Endpoints.LOG_ORGANIZER_BATCH);
            return;
        }

        int pollInterval = config.getInteger(Const.Config.SqsPollIntervalSecondsProp, 5);
        LOGGER.info("sending {} every {}s", Const.Event.BatchPoll, pollInterval);
        vertx.setPeriodic(1000L * pollInterval, id -> {
            LOGGER.trace("sending " + Const.Event.BatchPoll);
            vertx.eventBus().send(Const.Event.BatchPoll, id);
        });
    }

    private void closeClients() {
        try {
            this.sqsClient.close();
            this.s3Client.close();
            LOGGER.info("AWS clients closed");
        } catch (Exception e) {
            LOGGER.error("Error closing AWS clients", e);
        }
    }

    private static SqsClient createSqsClient(JsonObject config) {
        SqsClientBuilder builder = SqsClient.builder();
        String region = config.getString(Const.Config.AwsRegionProp);
        if (region != null) {
            builder.region(Region.of(region));
        }
        String endpoint = config.getString(Const.Config.SqsEndpointProp);
        if (endpoint != null) {
            builder.endpointOverride(URI.create(endpoint));
        }
        return builder.build();
    }

    private static S3Client createS3Client(JsonObject config) {
        S3ClientBuilder builder = S3Client.builder();
        String region = config.getString(Const.Config.AwsRegionProp);
        if (region != null) {
            builder.region(Region.of(region));
        }
        String endpoint = config.getString(Const.Config.S3EndpointProp);
        if (endpoint != null) {
            builder.endpointOverride(URI.create(endpoint)).forcePathStyle(true);
        }
        return builder.build();
    }
}
