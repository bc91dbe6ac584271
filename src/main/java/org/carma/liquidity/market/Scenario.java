package org.carma.liquidity.market;

import org.carma.liquidity.model.MarketVariable;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Day-indexed exogenous market path.
 *
 * Each driven variable has one cumulative level per day (not a daily change).
 * The engine derives day-over-day deltas itself; day 0 is measured against an
 * implicit zero baseline.
 */
public class Scenario {

    private final String name;
    private final int horizonDays;
    private final Map<MarketVariable, double[]> paths;

    public Scenario(String name, int horizonDays, Map<MarketVariable, double[]> paths) {
        this.name = Objects.requireNonNull(name, "Scenario name cannot be null");
        if (horizonDays < 1) {
            throw new IllegalArgumentException("Scenario horizon must be >= 1 day: " + horizonDays);
        }
        this.horizonDays = horizonDays;
        EnumMap<MarketVariable, double[]> copy = new EnumMap<>(MarketVariable.class);
        for (Map.Entry<MarketVariable, double[]> e : Objects.requireNonNull(paths, "paths").entrySet()) {
            double[] path = e.getValue();
            if (path == null || path.length != horizonDays) {
                throw new IllegalArgumentException(String.format(
                    "Path for %s has %d values, horizon is %d days",
                    e.getKey(), path == null ? 0 : path.length, horizonDays));
            }
            for (int d = 0; d < path.length; d++) {
                if (!Double.isFinite(path[d])) {
                    throw new IllegalArgumentException("Path for " + e.getKey() + " is not finite on day " + d);
                }
            }
            copy.put(e.getKey(), path.clone());
        }
        this.paths = Collections.unmodifiableMap(copy);
    }

    public String getName() {
        return name;
    }

    public int getHorizonDays() {
        return horizonDays;
    }

    public boolean drives(MarketVariable variable) {
        return paths.containsKey(variable);
    }

    public Set<MarketVariable> getDrivenVariables() {
        return paths.keySet();
    }

    /**
     * Copy of the path for one variable.
     */
    public double[] path(MarketVariable variable) {
        double[] path = paths.get(variable);
        return path == null ? null : path.clone();
    }

    /**
     * Cumulative levels of every driven variable on a day.
     */
    public Map<MarketVariable, Double> levels(int day) {
        checkDay(day);
        EnumMap<MarketVariable, Double> result = new EnumMap<>(MarketVariable.class);
        for (Map.Entry<MarketVariable, double[]> e : paths.entrySet()) {
            result.put(e.getKey(), e.getValue()[day]);
        }
        return result;
    }

    /**
     * Day-over-day change of every driven variable. Day 0 is measured against zero.
     */
    public Map<MarketVariable, Double> delta(int day) {
        checkDay(day);
        EnumMap<MarketVariable, Double> result = new EnumMap<>(MarketVariable.class);
        for (Map.Entry<MarketVariable, double[]> e : paths.entrySet()) {
            double[] p = e.getValue();
            double previous = day == 0 ? 0.0 : p[day - 1];
            result.put(e.getKey(), p[day] - previous);
        }
        return result;
    }

    private void checkDay(int day) {
        if (day < 0 || day >= horizonDays) {
            throw new IndexOutOfBoundsException("Day " + day + " outside horizon of " + horizonDays + " days");
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Scenario[").append(name)
            .append(", ").append(horizonDays).append(" days");
        for (Map.Entry<MarketVariable, double[]> e : paths.entrySet()) {
            sb.append(", ").append(e.getKey().getId()).append('=').append(Arrays.toString(e.getValue()));
        }
        return sb.append(']').toString();
    }
}
