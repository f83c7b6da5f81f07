package com.convexlab.modeling.orchestration;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import lombok.Data;

/**
 * Outcome of an orchestrator run: one {@link UnitStatus} per unit.
 */
@Data
public class RunReport {

    private final SolveMode mode;
    private final Instant startedAt;
    private final List<UnitStatus> units = new ArrayList<>();
    private long durationMillis;

    public boolean isAllSolved() {
        return units.stream().noneMatch(UnitStatus::isFailure);
    }

    public long count(UnitStatus.Status status) {
        return units.stream().filter(u -> u.getStatus() == status).count();
    }

    public List<UnitStatus> failures() {
        return units.stream().filter(UnitStatus::isFailure).toList();
    }

    /**
     * Status of {@code unit} in {@code scenario}, or {@code null}.
     */
    public UnitStatus find(String scenario, String unit) {
        return units.stream()
                .filter(u -> u.getScenario().equals(scenario) && u.getUnit().equals(unit))
                .findFirst()
                .orElse(null);
    }
}
