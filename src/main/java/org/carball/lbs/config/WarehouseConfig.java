package org.carball.lbs.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Connection settings and star-schema layout of the warehouse. Defaults describe the
 * AdventureWorksDW internet sales fact.
 */
@Data
public class WarehouseConfig {

    @JsonProperty("jdbc_url")
    private String jdbcUrl;

    @JsonProperty("username")
    private String username;

    @JsonProperty("password")
    private String password;

    @JsonProperty("query_timeout_seconds")
    private int queryTimeoutSeconds = 300;

    @JsonProperty("fact_table")
    private String factTable = "dbo.FactInternetSales";

    @JsonProperty("fact_alias")
    private String factAlias = "sal";

    @JsonProperty("fact_date_key")
    private String factDateKey = "OrderDateKey";

    @JsonProperty("date_table")
    private String dateTable = "dbo.DimDate";

    @JsonProperty("date_alias")
    private String dateAlias = "dt";

    @JsonProperty("date_key")
    private String dateKey = "DateKey";

    @JsonProperty("date_column")
    private String dateColumn = "FullDateAlternateKey";

    @JsonProperty("record_count_expression")
    private String recordCountExpression = "COUNT(DISTINCT sal.SalesOrderNumber)";

    /** Fixed "today" (yyyy-MM-dd) for historical warehouses; the database clock when unset. */
    @JsonProperty("anchor_date")
    private String anchorDate;

    @JsonProperty("default_metric")
    private String defaultMetric = "SalesAmount";

    @JsonProperty("metrics")
    private List<String> metrics = new ArrayList<>(List.of(
            "SalesAmount", "OrderQuantity", "TotalProductCost", "TaxAmt", "Freight", "UnitPrice"));

    @JsonProperty("metric_labels")
    private Map<String, String> metricLabels = new LinkedHashMap<>(Map.of(
            "SalesAmount", "sales",
            "OrderQuantity", "order quantity",
            "TotalProductCost", "product cost"));

    @JsonProperty("dimensions")
    private Map<String, DimensionSpec> dimensions = defaultDimensions();

    public boolean isConfigured() {
        return jdbcUrl != null && !jdbcUrl.isBlank();
    }

    @JsonIgnore
    public String metricLabel(String metric) {
        return metricLabels.getOrDefault(metric, metric);
    }

    private static Map<String, DimensionSpec> defaultDimensions() {
        Map<String, DimensionSpec> dims = new LinkedHashMap<>();
        dims.put("ProductKey", new DimensionSpec("Product", "dbo.DimProduct", "prod", "ProductKey",
                "prod.EnglishProductName", "pc.EnglishProductCategoryName",
                "LEFT JOIN dbo.DimProductSubcategory psc ON psc.ProductSubcategoryKey = prod.ProductSubcategoryKey "
                        + "LEFT JOIN dbo.DimProductCategory pc ON pc.ProductCategoryKey = psc.ProductCategoryKey"));
        dims.put("CustomerKey", new DimensionSpec("Customer", "dbo.DimCustomer", "cust", "CustomerKey",
                "cust.FirstName + ' ' + cust.LastName", null, null));
        dims.put("SalesTerritoryKey", new DimensionSpec("Territory", "dbo.DimSalesTerritory", "st",
                "SalesTerritoryKey", "st.SalesTerritoryRegion", "st.SalesTerritoryCountry", null));
        dims.put("PromotionKey", new DimensionSpec("Promotion", "dbo.DimPromotion", "promo", "PromotionKey",
                "promo.EnglishPromotionName", "promo.EnglishPromotionCategory", null));
        return dims;
    }
}
