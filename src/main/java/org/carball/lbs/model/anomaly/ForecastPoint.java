package org.carball.lbs.model.anomaly;

import java.time.LocalDate;

public record ForecastPoint(LocalDate date, double forecast, double lower, double upper, double trend) {
}
