package com.convexlab.modeling.convergence;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.convexlab.modeling.model.Coordinate;

import lombok.Getter;

/**
 * Decides whether a coupling loop has converged by comparing the shared
 * tables before and after a full pass.
 *
 * The first iteration never converges, nor does an iteration in which a
 * table had no prior values.
 */
public class ConvergenceMonitor {
    private static final Logger log = LoggerFactory.getLogger(ConvergenceMonitor.class);

    private static final double ZERO_THRESHOLD = 1e-12;

    @Getter
    private final ConvergenceSettings settings;

    public ConvergenceMonitor(ConvergenceSettings settings) {
        this.settings = settings;
    }

    /**
     * @param before shared table values at the start of the pass, by table
     * @param after  shared table values at the end of the pass, by table
     */
    public ConvergenceCheck check(int iteration, Map<String, Map<Coordinate, Double>> before,
            Map<String, Map<Coordinate, Double>> after) {
        Map<String, Double> perTable = new LinkedHashMap<>();
        Accumulator global = new Accumulator();
        boolean missingPrior = false;

        for (Map.Entry<String, Map<Coordinate, Double>> entry : after.entrySet()) {
            Map<Coordinate, Double> previous = before.get(entry.getKey());
            if (previous == null || previous.isEmpty()) {
                missingPrior = true;
                perTable.put(entry.getKey(), Double.POSITIVE_INFINITY);
                continue;
            }
            Accumulator table = new Accumulator();
            for (Map.Entry<Coordinate, Double> value : entry.getValue().entrySet()) {
                Double prior = previous.get(value.getKey());
                if (prior == null) {
                    missingPrior = true;
                    table.unbounded = true;
                    continue;
                }
                table.add(prior, value.getValue());
                global.add(prior, value.getValue());
            }
            perTable.put(entry.getKey(), table.norm(settings.getNorm()));
        }

        double norm;
        if (missingPrior) {
            norm = Double.POSITIVE_INFINITY;
        } else if (settings.getAggregation() == NormAggregation.GLOBAL) {
            norm = global.norm(settings.getNorm());
        } else {
            norm = perTable.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        }

        boolean converged = iteration > 1 && !missingPrior && norm <= settings.getTolerance();
        log.info("Iteration {}: {} norm {} (tolerance {}){}", iteration, settings.getNorm(), format(norm),
                settings.getTolerance(), converged ? " - converged" : "");
        if (log.isDebugEnabled()) {
            perTable.forEach((table, value) -> log.debug("  table '{}': {}", table, format(value)));
        }
        return new ConvergenceCheck(iteration, converged, norm, perTable);
    }

    private static String format(double norm) {
        return Double.isInfinite(norm) ? "inf" : String.format("%.6g", norm);
    }

    /**
     * Change of {@code after} relative to {@code before}; the absolute change
     * when {@code before} is zero.
     */
    public static double relativeDifference(double before, double after) {
        return relative(Math.abs(after - before), Math.abs(before));
    }

    private static double relative(double diff, double reference) {
        return reference < ZERO_THRESHOLD ? diff : diff / reference;
    }

    private static final class Accumulator {
        private double maxAbsolute;
        private double maxRelative;
        private double squaredDiff;
        private double squaredBefore;
        private boolean unbounded;

        void add(double before, double after) {
            double diff = Math.abs(after - before);
            maxAbsolute = Math.max(maxAbsolute, diff);
            maxRelative = Math.max(maxRelative, relative(diff, Math.abs(before)));
            squaredDiff += diff * diff;
            squaredBefore += before * before;
        }

        double norm(ConvergenceNorm kind) {
            if (unbounded) {
                return Double.POSITIVE_INFINITY;
            }
            return switch (kind) {
                case MAX_ABSOLUTE -> maxAbsolute;
                case MAX_RELATIVE -> maxRelative;
                case RELATIVE_L2 -> relative(Math.sqrt(squaredDiff), Math.sqrt(squaredBefore));
            };
        }
    }
}
