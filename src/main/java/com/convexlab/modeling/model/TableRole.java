package com.convexlab.modeling.model;

import java.util.Map;

import com.convexlab.modeling.exception.ModelDefinitionException;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

/**
 * Classification of a data table: exogenous input, endogenous solver output,
 * generated constant, or a per-subproblem mix of those.
 */
public abstract class TableRole {

    private TableRole() {
    }

    public static TableRole exogenous() {
        return Exogenous.INSTANCE;
    }

    public static TableRole endogenous() {
        return Endogenous.INSTANCE;
    }

    public static TableRole constant(String generator) {
        return new Constant(generator);
    }

    public static TableRole perSubproblem(Map<String, TableRole> roles) {
        for (Map.Entry<String, TableRole> entry : roles.entrySet()) {
            if (entry.getValue() instanceof PerSubproblem) {
                throw new ModelDefinitionException("Nested per-subproblem role for problem '" + entry.getKey() + "'");
            }
        }
        return new PerSubproblem(Map.copyOf(roles));
    }

    /**
     * Concrete role of the table inside {@code problemName}.
     */
    public abstract ResolvedRole resolve(String problemName);

    public boolean isPerSubproblem() {
        return false;
    }

    public static final class Exogenous extends TableRole {
        private static final Exogenous INSTANCE = new Exogenous();

        @Override
        public ResolvedRole resolve(String problemName) {
            return ResolvedRole.EXOGENOUS;
        }

        @Override
        public String toString() {
            return "exogenous";
        }
    }

    public static final class Endogenous extends TableRole {
        private static final Endogenous INSTANCE = new Endogenous();

        @Override
        public ResolvedRole resolve(String problemName) {
            return ResolvedRole.ENDOGENOUS;
        }

        @Override
        public String toString() {
            return "endogenous";
        }
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Constant extends TableRole {
        @NonNull
        String generator;

        @Override
        public ResolvedRole resolve(String problemName) {
            return ResolvedRole.CONSTANT;
        }

        @Override
        public String toString() {
            return "constant(" + generator + ")";
        }
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class PerSubproblem extends TableRole {
        @NonNull
        Map<String, TableRole> roles;

        @Override
        public ResolvedRole resolve(String problemName) {
            TableRole role = roles.get(problemName);
            if (role == null) {
                throw new ModelDefinitionException("No role declared for problem '" + problemName
                        + "'. Declared problems: " + roles.keySet());
            }
            return role.resolve(problemName);
        }

        @Override
        public boolean isPerSubproblem() {
            return true;
        }

        @Override
        public String toString() {
            return "per-subproblem" + roles;
        }
    }
}
