package org.carball.lbs.detector;

import lombok.extern.slf4j.Slf4j;
import org.carball.lbs.cache.ResultCache;
import org.carball.lbs.config.DetectionConfig;
import org.carball.lbs.config.DimensionSpec;
import org.carball.lbs.config.WarehouseConfig;
import org.carball.lbs.exception.DataProviderException;
import org.carball.lbs.exception.DetectionFailedException;
import org.carball.lbs.model.anomaly.ComparisonType;
import org.carball.lbs.model.anomaly.CompositeDetectionResult;
import org.carball.lbs.model.anomaly.DetectionMethod;
import org.carball.lbs.model.anomaly.DetectionRequest;
import org.carball.lbs.model.anomaly.DetectionResult;
import org.carball.lbs.model.anomaly.Granularity;
import org.carball.lbs.model.data.AggregateRow;
import org.carball.lbs.warehouse.AggregateQuery;
import org.carball.lbs.warehouse.WarehouseDataProvider;
import org.carball.lbs.warehouse.WarehouseQueries;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Entry point of the detector engine. Validates requests, fills in configured defaults, serves
 * repeated requests from the cache and dispatches to the individual detectors.
 */
@Slf4j
public class AnomalyDetectionService {

    static final int MAX_LOOKBACK_DAYS = 3650;
    static final int MAX_TOP_N = 1000;
    static final int MAX_FORECAST_DAYS = 365;

    private static final Map<DetectionMethod, Set<String>> ACCEPTED_PARAMETERS = Map.of(
            DetectionMethod.TIME_SERIES, Set.of("metric", "granularity", "lookback_days"),
            DetectionMethod.ZSCORE, Set.of("metric", "dimension", "threshold"),
            DetectionMethod.IQR, Set.of("metric", "dimension", "threshold"),
            DetectionMethod.ISOLATION_FOREST, Set.of("metric", "dimension"),
            DetectionMethod.PERIOD_COMPARISON, Set.of("metric", "comparison_type", "threshold"),
            DetectionMethod.DAY_ON_DAY, Set.of("metric", "dimension", "threshold", "top_n", "lookback_days"),
            DetectionMethod.FORECAST, Set.of("metric", "lookback_days", "forecast_days"));

    private final WarehouseDataProvider provider;
    private final WarehouseQueries queries;
    private final WarehouseConfig warehouse;
    private final DetectionConfig config;
    private final ResultCache cache;

    private final TimeSeriesDetector timeSeries;
    private final CrossSectionalDetector crossSectional;
    private final PeriodComparisonDetector periodComparison;
    private final DayOnDayDetector dayOnDay;
    private final ForecastDetector forecast;

    /**
     * @param cache result cache, or null to always query the warehouse
     */
    public AnomalyDetectionService(WarehouseDataProvider provider, WarehouseConfig warehouse,
                                   DetectionConfig config, ResultCache cache) {
        this.provider = provider;
        this.queries = new WarehouseQueries(warehouse);
        this.warehouse = warehouse;
        this.config = config;
        this.cache = cache;

        this.timeSeries = new TimeSeriesDetector(config);
        this.crossSectional = new CrossSectionalDetector(config);
        this.periodComparison = new PeriodComparisonDetector();
        this.dayOnDay = new DayOnDayDetector(config);
        this.forecast = new ForecastDetector(config.getForecast());
    }

    /**
     * Runs one detection.
     *
     * @throws IllegalArgumentException  for unknown metrics, dimensions or out-of-range parameters
     * @throws DetectionFailedException  when the warehouse query fails
     */
    public DetectionResult detect(DetectionRequest request) {
        DetectionRequest resolved = resolve(request);
        Map<String, Object> parameters = resolved.toParameters();

        if (cache != null) {
            Optional<DetectionResult> cached = cache.getDetection(parameters);
            if (cached.isPresent()) {
                log.debug("Cache hit for {}", parameters);
                return cached.get();
            }
        }

        log.info("Running {} detection with {}", resolved.getMethod().getLabel(), parameters);
        DetectionResult result = run(resolved, parameters);
        log.info("{} detection finished: {} anomalies ({})", resolved.getMethod().getLabel(),
                result.getAnomalyCount(), result.getStatus().getLabel());

        if (cache != null) {
            cache.putDetection(result);
        }
        return result;
    }

    /**
     * Runs the standard battery of detectors. A failing detector is reported in
     * {@code errors} without stopping the others.
     */
    public CompositeDetectionResult detectAll() {
        Map<String, DetectionRequest> battery = defaultBattery();
        Map<String, DetectionResult> results = new LinkedHashMap<>();
        Map<String, String> errors = new LinkedHashMap<>();

        for (Map.Entry<String, DetectionRequest> entry : battery.entrySet()) {
            try {
                results.put(entry.getKey(), detect(entry.getValue()));
            } catch (RuntimeException e) {
                log.error("Detector {} failed: {}", entry.getKey(), e.getMessage());
                errors.put(entry.getKey(), e.getMessage());
            }
        }

        int total = results.values().stream().mapToInt(DetectionResult::getAnomalyCount).sum();
        String status;
        if (errors.isEmpty()) {
            status = CompositeDetectionResult.SUCCESS;
        } else if (results.isEmpty()) {
            status = CompositeDetectionResult.FAILED;
        } else {
            status = CompositeDetectionResult.PARTIAL;
        }

        log.info("Detect-all finished with status {}: {} anomalies from {} detectors, {} errors",
                status, total, results.size(), errors.size());

        return CompositeDetectionResult.builder()
                .timestamp(Instant.now())
                .results(results)
                .errors(errors)
                .totalAnomalies(total)
                .detectionMethods(results.size())
                .status(status)
                .build();
    }

    Map<String, DetectionRequest> defaultBattery() {
        Map<String, DetectionRequest> battery = new LinkedHashMap<>();
        battery.put("time_series_daily", DetectionRequest.builder()
                .method(DetectionMethod.TIME_SERIES).granularity(Granularity.DAILY).lookbackDays(30).build());
        battery.put("time_series_monthly", DetectionRequest.builder()
                .method(DetectionMethod.TIME_SERIES).granularity(Granularity.MONTHLY).lookbackDays(365).build());
        battery.put("statistical_zscore", DetectionRequest.builder()
                .method(DetectionMethod.ZSCORE).dimension(config.getPrimaryDimension()).build());
        battery.put("statistical_isolation_forest", DetectionRequest.builder()
                .method(DetectionMethod.ISOLATION_FOREST).dimension(config.getSecondaryDimension()).build());
        battery.put("comparative_yoy", DetectionRequest.builder()
                .method(DetectionMethod.PERIOD_COMPARISON).comparisonType(ComparisonType.YOY).threshold(15.0).build());
        battery.put("comparative_mom", DetectionRequest.builder()
                .method(DetectionMethod.PERIOD_COMPARISON).comparisonType(ComparisonType.MOM).threshold(20.0).build());
        return battery;
    }

    /**
     * Validates a request and fills every unset parameter the method uses with its configured
     * default.
     */
    public DetectionRequest resolve(DetectionRequest request) {
        if (request == null || request.getMethod() == null) {
            throw new IllegalArgumentException("Detection method is required. Available methods: "
                    + DetectionMethod.getAvailableMethods());
        }
        DetectionMethod method = request.getMethod();
        Set<String> accepted = ACCEPTED_PARAMETERS.get(method);
        for (String name : request.toParameters().keySet()) {
            if (!name.equals("method") && !accepted.contains(name)) {
                throw new IllegalArgumentException("Parameter %s does not apply to %s detection. Accepted: %s"
                        .formatted(name, method.getLabel(), String.join(", ", accepted)));
            }
        }

        DetectionRequest.DetectionRequestBuilder resolved = DetectionRequest.builder()
                .method(method)
                .metric(queries.metric(request.getMetric() != null ? request.getMetric() : warehouse.getDefaultMetric()));

        switch (method) {
            case TIME_SERIES -> resolved
                    .granularity(request.getGranularity() != null ? request.getGranularity() : Granularity.DAILY)
                    .lookbackDays(lookback(request.getLookbackDays(), config.getTimeSeriesLookbackDays()));
            case ZSCORE -> resolved
                    .dimension(dimension(request))
                    .threshold(positive(request.getThreshold(), config.getZscoreThreshold(), "threshold"));
            case IQR -> resolved
                    .dimension(dimension(request))
                    .threshold(positive(request.getThreshold(), config.getIqrMultiplier(), "threshold"));
            case ISOLATION_FOREST -> resolved.dimension(dimension(request));
            case PERIOD_COMPARISON -> resolved
                    .comparisonType(request.getComparisonType() != null ? request.getComparisonType() : ComparisonType.YOY)
                    .threshold(positive(request.getThreshold(), config.getComparativeThresholdPct(), "threshold"));
            case DAY_ON_DAY -> resolved
                    .dimension(dimension(request))
                    .threshold(positive(request.getThreshold(), config.getDayOnDayThresholdPct(), "threshold"))
                    .topN(range(request.getTopN(), config.getDayOnDayTopN(), 1, MAX_TOP_N, "top_n"))
                    .lookbackDays(lookback(request.getLookbackDays(), config.getDayOnDayLookbackDays()));
            case FORECAST -> resolved
                    .lookbackDays(lookback(request.getLookbackDays(), config.getForecast().getLookbackDays()))
                    .forecastDays(range(request.getForecastDays(), config.getForecast().getForecastDays(),
                            1, MAX_FORECAST_DAYS, "forecast_days"));
        }
        return resolved.build();
    }

    private String dimension(DetectionRequest request) {
        String dimension = request.getDimension() != null ? request.getDimension() : config.getPrimaryDimension();
        queries.dimension(dimension);
        return dimension;
    }

    private DetectionResult run(DetectionRequest request, Map<String, Object> parameters) {
        String metric = request.getMetric();
        return switch (request.getMethod()) {
            case TIME_SERIES -> timeSeries.detect(
                    fetch(request, parameters, queries.timeSeries(metric, request.getGranularity(), request.getLookbackDays())),
                    metric, request.getGranularity(), request.getLookbackDays(), parameters);
            case ZSCORE -> crossSectional.detectZScore(
                    fetch(request, parameters, queries.dimensionTotals(request.getDimension(), metric)),
                    request.getDimension(), request.getThreshold(), parameters);
            case IQR -> crossSectional.detectIqr(
                    fetch(request, parameters, queries.dimensionTotals(request.getDimension(), metric)),
                    request.getDimension(), request.getThreshold(), parameters);
            case ISOLATION_FOREST -> crossSectional.detectIsolationForest(
                    fetch(request, parameters, queries.dimensionTotals(request.getDimension(), metric)),
                    request.getDimension(), parameters);
            case PERIOD_COMPARISON -> periodComparison.detect(
                    fetch(request, parameters, queries.periodTotals(metric, request.getComparisonType())),
                    metric, request.getComparisonType(), request.getThreshold(), parameters);
            case DAY_ON_DAY -> {
                DimensionSpec spec = queries.dimension(request.getDimension());
                yield dayOnDay.detect(
                        fetch(request, parameters, queries.dailyByEntity(request.getDimension(), metric,
                                request.getLookbackDays(), request.getTopN())),
                        request.getDimension(), spec.getLabel(), warehouse.metricLabel(metric),
                        request.getThreshold(), request.getTopN(), request.getLookbackDays(), parameters);
            }
            case FORECAST -> forecast.detect(
                    fetch(request, parameters, queries.dailyTotals(metric, request.getLookbackDays())),
                    metric, request.getLookbackDays(), request.getForecastDays(), parameters);
        };
    }

    private List<AggregateRow> fetch(DetectionRequest request, Map<String, Object> parameters, AggregateQuery query) {
        try {
            List<AggregateRow> rows = provider.runAggregate(query);
            log.debug("Fetched {} rows for {}", rows.size(), request.getMethod().getLabel());
            return rows;
        } catch (DataProviderException e) {
            throw new DetectionFailedException(request.getMethod(), parameters, e);
        }
    }

    private static int lookback(Integer requested, int fallback) {
        return range(requested, fallback, 1, MAX_LOOKBACK_DAYS, "lookback_days");
    }

    private static int range(Integer requested, int fallback, int min, int max, String name) {
        int value = requested != null ? requested : fallback;
        if (value < min || value > max) {
            throw new IllegalArgumentException("%s must be between %d and %d, got %d".formatted(name, min, max, value));
        }
        return value;
    }

    private static double positive(Double requested, double fallback, String name) {
        double value = requested != null ? requested : fallback;
        if (!Double.isFinite(value) || value <= 0) {
            throw new IllegalArgumentException(name + " must be a positive number, got " + value);
        }
        return value;
    }
}
