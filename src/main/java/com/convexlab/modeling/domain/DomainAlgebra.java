package com.convexlab.modeling.domain;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.convexlab.modeling.exception.DimensionMismatchException;
import com.convexlab.modeling.exception.ModelDefinitionException;
import com.convexlab.modeling.model.Domain;
import com.convexlab.modeling.model.IndexSet;
import com.convexlab.modeling.model.SetFilter;
import com.convexlab.modeling.model.VariableDefinition;

/**
 * Filtering and partitioning of domains. Stateless.
 */
public class DomainAlgebra {
    private static final Logger log = LoggerFactory.getLogger(DomainAlgebra.class);

    /**
     * Restricts {@code domain} by one filter per set; sets without a filter keep all items.
     *
     * @throws ModelDefinitionException if a filter names a set outside the domain,
     *         an unknown filter label or an unknown item
     */
    public SubDomain filter(Domain domain, Map<String, SetFilter> filters) {
        return filter(SubDomain.full(domain), filters);
    }

    /**
     * Further restricts a sub-domain. Applying the same filters twice yields the same result.
     */
    public SubDomain filter(SubDomain subDomain, Map<String, SetFilter> filters) {
        Domain domain = subDomain.getDomain();
        for (String setName : filters.keySet()) {
            if (!domain.contains(setName)) {
                throw new ModelDefinitionException("Filter on set '" + setName + "' which is not part of domain "
                        + domain.setNames());
            }
        }
        Map<String, List<String>> items = new LinkedHashMap<>();
        for (IndexSet set : domain.getSets()) {
            List<String> candidates = subDomain.itemsOf(set.getName());
            SetFilter filter = filters.get(set.getName());
            items.put(set.getName(), filter == null ? candidates : filter.apply(set, candidates));
        }
        SubDomain result = new SubDomain(domain, items);
        log.trace("Filtered domain {} to {} of {} tuples", domain.setNames(), result.size(), subDomain.size());
        return result;
    }

    /**
     * Splits the table domain into row, column, intra-problem and inter-problem sets
     * according to the variable's allocation.
     *
     * @throws DimensionMismatchException if an allocated set is outside the table domain
     *         or inter-problem, if allocated sets overlap, or if they do not cover every
     *         dimension set of the table
     */
    public DomainPartition partition(Domain tableDomain, VariableDefinition variable) {
        String where = "Variable '" + variable.getName() + "' of table '" + variable.getTable() + "'";
        Set<String> allocated = new LinkedHashSet<>();

        IndexSet rowSet = allocate(tableDomain, variable.getRows(), "rows", allocated, where);
        IndexSet colSet = allocate(tableDomain, variable.getCols(), "cols", allocated, where);

        List<IndexSet> intraSets = new ArrayList<>();
        if (variable.getIntra() != null) {
            for (String setName : variable.getIntra()) {
                intraSets.add(allocate(tableDomain, setName, "intra", allocated, where));
            }
        } else {
            for (IndexSet set : tableDomain.dimensionPart().getSets()) {
                if (!allocated.contains(set.getName())) {
                    allocated.add(set.getName());
                    intraSets.add(set);
                }
            }
        }

        List<String> missing = new ArrayList<>();
        for (IndexSet set : tableDomain.dimensionPart().getSets()) {
            if (!allocated.contains(set.getName())) {
                missing.add(set.getName());
            }
        }
        if (!missing.isEmpty()) {
            throw new DimensionMismatchException(where + " does not allocate sets " + missing
                    + " of the table domain " + tableDomain.setNames());
        }

        return new DomainPartition(rowSet, colSet, intraSets, tableDomain.interProblemPart().getSets());
    }

    private IndexSet allocate(Domain domain, String setName, String slot, Set<String> allocated, String where) {
        if (setName == null) {
            return null;
        }
        IndexSet set = domain.find(setName).orElseThrow(() -> new DimensionMismatchException(where + " allocates set '"
                + setName + "' as " + slot + ", but the table domain is " + domain.setNames()));
        if (set.isInterProblem()) {
            throw new DimensionMismatchException(where + " allocates inter-problem set '" + setName + "' as " + slot);
        }
        if (!allocated.add(setName)) {
            throw new DimensionMismatchException(where + " allocates set '" + setName + "' more than once");
        }
        return set;
    }
}
