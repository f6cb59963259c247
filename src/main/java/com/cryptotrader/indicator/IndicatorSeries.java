package com.cryptotrader.indicator;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;
import lombok.ToString;

/**
 * Calculated indicator: one or more named columns aligned with the bars of the input
 * series. Values before an indicator has enough history may be null.
 */
@Getter
@ToString
public class IndicatorSeries {

    private final String name;
    private final Map<String, List<BigDecimal>> columns;

    public IndicatorSeries(String name, Map<String, List<BigDecimal>> columns) {
        this.name = name;
        Map<String, List<BigDecimal>> copy = new LinkedHashMap<>();
        columns.forEach((column, values) -> copy.put(column, Collections.unmodifiableList(values)));
        this.columns = Collections.unmodifiableMap(copy);
    }

    public List<BigDecimal> column(String column) {
        List<BigDecimal> values = columns.get(column);
        if (values == null) {
            throw new IllegalArgumentException("Indicator " + name + " has no column '" + column + "'");
        }
        return values;
    }

    /** Most recent value of a column, empty when the column is empty or the last value is undefined. */
    public Optional<BigDecimal> latest(String column) {
        List<BigDecimal> values = column(column);
        return values.isEmpty() ? Optional.empty() : Optional.ofNullable(values.get(values.size() - 1));
    }

    /** Most recent value of the first column. */
    public Optional<BigDecimal> latest() {
        return latest(columns.keySet().iterator().next());
    }

    public int size() {
        return columns.isEmpty() ? 0 : columns.values().iterator().next().size();
    }
}
