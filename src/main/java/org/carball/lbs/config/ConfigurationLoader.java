package org.carball.lbs.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    private final ObjectMapper yamlMapper;

    public ConfigurationLoader() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > YAML file > defaults
     */
    public EngineConfig loadConfiguration(String configFile, String[] args) {
        return loadConfiguration(configFile, null, args, System.getenv());
    }

    /**
     * Loads configuration, applying a sensitivity profile on top of the file before the
     * environment and CLI overrides.
     */
    public EngineConfig loadConfigurationWithProfile(String profileName, String configFile, String[] args) {
        return loadConfiguration(configFile, profileName, args, System.getenv());
    }

    EngineConfig loadConfiguration(String configFile, String profileName, String[] args, Map<String, String> env) {
        log.debug("Loading configuration");

        // 1. YAML file over built-in defaults
        EngineConfig config = configFile != null ? readFile(configFile) : new EngineConfig();

        // 2. Sensitivity profile
        if (profileName != null) {
            try {
                SensitivityProfile profile = SensitivityProfile.fromName(profileName);
                config.setDetection(profile.applyTo(config.getDetection()));
            } catch (IllegalArgumentException e) {
                log.error("Unknown profile: {}. {}", profileName, e.getMessage());
                throw e;
            }
        }

        // 3. Environment variables
        applyEnvironmentVariables(config, env);

        // 4. CLI arguments (highest priority)
        applyCLIArguments(config, args);

        config.getDetection().validate();
        log.info("Configuration loaded: {}", config.getDetection().getConfigurationSummary());
        return config;
    }

    private EngineConfig readFile(String configFile) {
        File file = new File(configFile);
        if (!file.exists()) {
            throw new IllegalArgumentException("Configuration file not found: " + configFile);
        }
        try {
            EngineConfig config = yamlMapper.readValue(file, EngineConfig.class);
            log.info("Read configuration file {}", file.getAbsolutePath());
            return config;
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid configuration file " + configFile + ": " + e.getMessage(), e);
        }
    }

    private void applyEnvironmentVariables(EngineConfig config, Map<String, String> env) {
        DetectionConfig detection = config.getDetection();
        try {
            if (env.containsKey("LBS_ZSCORE_THRESHOLD")) {
                detection.setZscoreThreshold(Double.parseDouble(env.get("LBS_ZSCORE_THRESHOLD")));
            }
            if (env.containsKey("LBS_IQR_MULTIPLIER")) {
                detection.setIqrMultiplier(Double.parseDouble(env.get("LBS_IQR_MULTIPLIER")));
            }
            if (env.containsKey("LBS_MIN_RECORDS_PER_GROUP")) {
                detection.setMinRecordsPerGroup(Long.parseLong(env.get("LBS_MIN_RECORDS_PER_GROUP")));
            }
            if (env.containsKey("LBS_COMPARATIVE_THRESHOLD_PCT")) {
                detection.setComparativeThresholdPct(Double.parseDouble(env.get("LBS_COMPARATIVE_THRESHOLD_PCT")));
            }
            if (env.containsKey("LBS_DAY_ON_DAY_THRESHOLD_PCT")) {
                detection.setDayOnDayThresholdPct(Double.parseDouble(env.get("LBS_DAY_ON_DAY_THRESHOLD_PCT")));
            }
            if (env.containsKey("LBS_ISOLATION_FOREST_SEED")) {
                detection.getIsolationForest().setSeed(Long.parseLong(env.get("LBS_ISOLATION_FOREST_SEED")));
            }
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value in environment: {}", e.getMessage());
        }

        if (env.containsKey("LBS_CACHE_BACKEND")) {
            config.getCache().setBackend(env.get("LBS_CACHE_BACKEND"));
        }
        if (env.containsKey("REDIS_URL")) {
            config.getCache().setRedisUrl(env.get("REDIS_URL"));
        }
        if (env.containsKey("LBS_LLM_BASE_URL")) {
            config.getLlm().setBaseUrl(env.get("LBS_LLM_BASE_URL"));
        }
        if (env.containsKey("LBS_LLM_MODEL")) {
            config.getLlm().setModel(env.get("LBS_LLM_MODEL"));
        }
        if (env.containsKey("OPENAI_API_KEY")) {
            config.getLlm().setApiKey(env.get("OPENAI_API_KEY"));
        }
        if (env.containsKey("LBS_DB_URL")) {
            config.getWarehouse().setJdbcUrl(env.get("LBS_DB_URL"));
        }
        if (env.containsKey("LBS_DB_USER")) {
            config.getWarehouse().setUsername(env.get("LBS_DB_USER"));
        }
        if (env.containsKey("LBS_DB_PASSWORD")) {
            config.getWarehouse().setPassword(env.get("LBS_DB_PASSWORD"));
        }
        if (env.containsKey("LBS_ANCHOR_DATE")) {
            config.getWarehouse().setAnchorDate(env.get("LBS_ANCHOR_DATE"));
        }
        if (env.containsKey("LBS_INDEX_PATH")) {
            config.getIndex().setPersistPath(env.get("LBS_INDEX_PATH"));
        }
    }

    private void applyCLIArguments(EngineConfig config, String[] args) {
        DetectionConfig detection = config.getDetection();
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            try {
                switch (arg) {
                    case "--detection.zscore-threshold":
                        detection.setZscoreThreshold(Double.parseDouble(value));
                        break;
                    case "--detection.iqr-multiplier":
                        detection.setIqrMultiplier(Double.parseDouble(value));
                        break;
                    case "--detection.min-records":
                        detection.setMinRecordsPerGroup(Long.parseLong(value));
                        break;
                    case "--detection.comparative-threshold":
                        detection.setComparativeThresholdPct(Double.parseDouble(value));
                        break;
                    case "--detection.day-on-day-threshold":
                        detection.setDayOnDayThresholdPct(Double.parseDouble(value));
                        break;
                    case "--detection.seed":
                        detection.getIsolationForest().setSeed(Long.parseLong(value));
                        break;
                    case "--cache.backend":
                        config.getCache().setBackend(value);
                        break;
                    case "--cache.redis-url":
                        config.getCache().setRedisUrl(value);
                        break;
                    case "--llm.base-url":
                        config.getLlm().setBaseUrl(value);
                        break;
                    case "--llm.model":
                        config.getLlm().setModel(value);
                        break;
                    case "--warehouse.jdbc-url":
                        config.getWarehouse().setJdbcUrl(value);
                        break;
                    case "--warehouse.anchor-date":
                        config.getWarehouse().setAnchorDate(value);
                        break;
                    case "--index.path":
                        config.getIndex().setPersistPath(value);
                        break;
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", arg, value);
            }
        }
    }

    /**
     * Returns help text for configuration options.
     */
    public static String getConfigurationHelp() {
        return """
            Configuration Options:

            CLI Arguments:
              --config <file>                       YAML configuration file
              --profile <name>                      Sensitivity profile (strict, balanced, sensitive, discovery)
              --detection.zscore-threshold <num>    Z-score threshold for cross-sectional outliers
              --detection.iqr-multiplier <num>      IQR fence multiplier
              --detection.min-records <num>         Minimum records per group
              --detection.comparative-threshold <pct>  Period-over-period change threshold
              --detection.day-on-day-threshold <pct>   Day-on-day change threshold
              --detection.seed <num>                Isolation forest seed
              --cache.backend <memory|redis>        Cache backend
              --cache.redis-url <url>               Redis connection URL
              --llm.base-url <url>                  OpenAI-compatible endpoint
              --llm.model <name>                    Chat model name
              --warehouse.jdbc-url <url>            Warehouse JDBC URL
              --warehouse.anchor-date <yyyy-MM-dd>  Fixed reference date for lookback windows
              --index.path <file>                   Example index file

            Environment Variables:
              LBS_ZSCORE_THRESHOLD, LBS_IQR_MULTIPLIER, LBS_MIN_RECORDS_PER_GROUP,
              LBS_COMPARATIVE_THRESHOLD_PCT, LBS_DAY_ON_DAY_THRESHOLD_PCT, LBS_ISOLATION_FOREST_SEED,
              LBS_CACHE_BACKEND, REDIS_URL, LBS_LLM_BASE_URL, LBS_LLM_MODEL, OPENAI_API_KEY,
              LBS_DB_URL, LBS_DB_USER, LBS_DB_PASSWORD, LBS_ANCHOR_DATE, LBS_INDEX_PATH

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Profile
              4. Configuration file
              5. Built-in defaults
            """;
    }
}
