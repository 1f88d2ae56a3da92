package org.carball.lbs.model.anomaly;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.LocalDate;

/**
 * Period-over-period comparison cycles. Buckets are identified by the first day of their period.
 */
public enum ComparisonType {
    YOY("yoy", "year over year") {
        @Override
        public LocalDate normalize(LocalDate date) {
            return date.withDayOfMonth(1);
        }

        @Override
        public LocalDate counterpart(LocalDate bucket) {
            return bucket.minusYears(1);
        }
    },
    MOM("mom", "month over month") {
        @Override
        public LocalDate normalize(LocalDate date) {
            return date.withDayOfMonth(1);
        }

        @Override
        public LocalDate counterpart(LocalDate bucket) {
            return bucket.minusMonths(1);
        }
    },
    QOQ("qoq", "quarter over quarter") {
        @Override
        public LocalDate normalize(LocalDate date) {
            int quarterStartMonth = ((date.getMonthValue() - 1) / 3) * 3 + 1;
            return LocalDate.of(date.getYear(), quarterStartMonth, 1);
        }

        @Override
        public LocalDate counterpart(LocalDate bucket) {
            return bucket.minusMonths(3);
        }
    };

    private final String label;
    private final String description;

    ComparisonType(String label, String description) {
        this.label = label;
        this.description = description;
    }

    /**
     * Maps any date inside a period to the first day of that period.
     */
    public abstract LocalDate normalize(LocalDate date);

    /**
     * The bucket a period is compared against.
     */
    public abstract LocalDate counterpart(LocalDate bucket);

    public boolean isQuarterly() {
        return this == QOQ;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public String getDescription() {
        return description;
    }

    @JsonCreator
    public static ComparisonType fromName(String name) {
        for (ComparisonType type : values()) {
            if (type.label.equalsIgnoreCase(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown comparison type: " + name + ". Use yoy, mom or qoq");
    }
}
