package com.convexlab.modeling.orchestration;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.convexlab.modeling.solver.SolveStatus;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

/**
 * Outcome of one solve unit: a problem or a coupling group within one scenario.
 */
@Data
@Builder
public class UnitStatus {

    public enum Kind {
        PROBLEM,
        COUPLING_GROUP
    }

    public enum Status {
        SOLVED,
        INFEASIBLE,
        UNBOUNDED,
        FAILED,
        NOT_CONVERGED,
        SKIPPED;

        public static Status of(SolveStatus status) {
            return switch (status) {
                case OPTIMAL -> SOLVED;
                case INFEASIBLE -> INFEASIBLE;
                case UNBOUNDED -> UNBOUNDED;
                case SOLVER_ERROR -> FAILED;
            };
        }
    }

    private String scenario;
    private String unit;
    private Kind kind;
    private Status status;
    private Double objectiveValue;
    private Integer iterations;
    private Double finalNorm;
    private CouplingState couplingState;
    private String errorMessage;
    private long durationMillis;

    /**
     * Member objectives of a coupling group, by problem.
     */
    @Builder.Default
    private Map<String, Double> memberObjectives = new LinkedHashMap<>();

    @Singular("norm")
    private List<Double> normHistory;

    public boolean isSolved() {
        return status == Status.SOLVED;
    }

    public boolean isFailure() {
        return status != Status.SOLVED && status != Status.SKIPPED;
    }

    public static UnitStatus skipped(String scenario, String unit, String reason) {
        return UnitStatus.builder()
                .scenario(scenario)
                .unit(unit)
                .kind(Kind.PROBLEM)
                .status(Status.SKIPPED)
                .errorMessage(reason)
                .build();
    }
}
