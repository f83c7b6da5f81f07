package com.convexlab.modeling.orchestration;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.convexlab.modeling.build.CompiledProblem;
import com.convexlab.modeling.exception.CircularDependencyException;
import com.convexlab.modeling.model.ModelDefinition;
import com.convexlab.modeling.model.ResolvedRole;

/**
 * Resolves table roles across the members of each coupling group and orders
 * the members for the Gauss-Seidel loop.
 */
public class RoleResolver {
    private static final Logger log = LoggerFactory.getLogger(RoleResolver.class);

    private final ModelDefinition model;
    private final CouplingTieBreak tieBreak;

    public RoleResolver(ModelDefinition model, CouplingTieBreak tieBreak) {
        this.model = model;
        this.tieBreak = tieBreak;
    }

    /**
     * Tables referenced by a problem with their role in it.
     */
    public Map<String, ResolvedRole> rolesIn(CompiledProblem problem) {
        Map<String, ResolvedRole> roles = new LinkedHashMap<>();
        for (String variable : problem.getVariableNames()) {
            String table = model.variable(variable).getTable();
            roles.putIfAbsent(table, model.table(table).roleIn(problem.getName()));
        }
        return roles;
    }

    /**
     * @param problems compiled problems in declaration order
     * @return coupling groups in order of first declaration
     * @throws CircularDependencyException if a table is endogenous in two members of a group
     */
    public List<CouplingGroup> resolveGroups(Map<String, CompiledProblem> problems) {
        Map<String, List<CompiledProblem>> byGroup = new LinkedHashMap<>();
        for (CompiledProblem problem : problems.values()) {
            if (problem.getDefinition().isCoupled()) {
                byGroup.computeIfAbsent(problem.getDefinition().getCouplingGroup(), g -> new ArrayList<>()).add(problem);
            }
        }

        List<CouplingGroup> groups = new ArrayList<>();
        byGroup.forEach((name, members) -> groups.add(resolve(name, members)));
        return groups;
    }

    private CouplingGroup resolve(String name, List<CompiledProblem> members) {
        List<CompiledProblem> ordered = new ArrayList<>(members);
        Comparator<CompiledProblem> byOrder = Comparator.comparing(
                p -> p.getDefinition().getCouplingOrder() == null ? Integer.MAX_VALUE : p.getDefinition().getCouplingOrder());
        if (tieBreak == CouplingTieBreak.NAME) {
            byOrder = byOrder.thenComparing(CompiledProblem::getName);
        }
        // List.sort is stable, so DECLARATION keeps the declared order among ties
        ordered.sort(byOrder);

        Map<String, String> producers = new LinkedHashMap<>();
        Set<String> consumed = new LinkedHashSet<>();
        for (CompiledProblem member : ordered) {
            rolesIn(member).forEach((table, role) -> {
                if (role == ResolvedRole.ENDOGENOUS) {
                    String previous = producers.putIfAbsent(table, member.getName());
                    if (previous != null) {
                        throw new CircularDependencyException("Table '" + table + "' is endogenous in both '"
                                + previous + "' and '" + member.getName() + "' of coupling group '" + name + "'");
                    }
                } else if (role == ResolvedRole.EXOGENOUS) {
                    consumed.add(table);
                }
            });
        }

        Set<String> shared = new LinkedHashSet<>();
        for (String table : producers.keySet()) {
            if (consumed.contains(table)) {
                shared.add(table);
            }
        }
        if (ordered.size() < 2) {
            log.warn("Coupling group '{}' has a single member", name);
        }
        if (shared.isEmpty()) {
            log.warn("Coupling group '{}' shares no table between its members", name);
        }
        CouplingGroup group = new CouplingGroup(name, List.copyOf(ordered), shared);
        log.info("Coupling group '{}': members {} sharing tables {}", name, group.memberNames(), shared);
        return group;
    }
}
