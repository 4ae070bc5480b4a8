package com.jay.proforma.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.jay.proforma.exception.RateCurveRangeException;
import com.jay.proforma.exception.ScenarioValidationException;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Forward index curve (e.g. SOFR) used by floating-rate tranches.
 * A lookup returns the latest point on or before the requested date. Dates before the first
 * point or after the last one are out of range and fail instead of extrapolating.
 */
public final class RateCurve {

    public record RatePoint(LocalDate date, double rate) {}

    private final NavigableMap<LocalDate, Double> rates;

    @JsonCreator
    public RateCurve(@JsonProperty("points") List<RatePoint> points) {
        TreeMap<LocalDate, Double> sorted = new TreeMap<>();
        if (points != null) {
            for (RatePoint p : points) {
                if (p.date() == null) {
                    throw new ScenarioValidationException("Rate curve point without a date");
                }
                if (sorted.put(p.date(), p.rate()) != null) {
                    throw new ScenarioValidationException("Rate curve has two points for " + p.date());
                }
            }
        }
        this.rates = Collections.unmodifiableNavigableMap(sorted);
    }

    public static RateCurve of(Map<LocalDate, Double> rates) {
        List<RatePoint> points = new ArrayList<>();
        rates.forEach((d, r) -> points.add(new RatePoint(d, r)));
        return new RateCurve(points);
    }

    public double rateAt(LocalDate date) {
        if (rates.isEmpty()) {
            throw new RateCurveRangeException("Rate curve is empty; cannot price " + date);
        }
        if (date.isBefore(rates.firstKey()) || date.isAfter(rates.lastKey())) {
            throw new RateCurveRangeException(date, rates.firstKey(), rates.lastKey());
        }
        return rates.floorEntry(date).getValue();
    }

    public boolean covers(LocalDate date) {
        return !rates.isEmpty() && !date.isBefore(rates.firstKey()) && !date.isAfter(rates.lastKey());
    }

    public boolean isEmpty() {
        return rates.isEmpty();
    }

    public LocalDate lastDate() {
        return rates.isEmpty() ? null : rates.lastKey();
    }

    @JsonProperty("points")
    public List<RatePoint> getPoints() {
        List<RatePoint> points = new ArrayList<>();
        rates.forEach((d, r) -> points.add(new RatePoint(d, r)));
        return points;
    }
}
