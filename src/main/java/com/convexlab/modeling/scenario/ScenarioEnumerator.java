package com.convexlab.modeling.scenario;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.convexlab.modeling.domain.CartesianProduct;
import com.convexlab.modeling.model.IndexSet;

/**
 * Enumerates scenarios as the Cartesian product of the inter-problem sets.
 */
public class ScenarioEnumerator {
    private static final Logger log = LoggerFactory.getLogger(ScenarioEnumerator.class);

    /**
     * @param interProblemSets sets in declared order
     * @return scenarios in lexicographic order; one base scenario when there are no sets
     */
    public List<Scenario> enumerate(List<IndexSet> interProblemSets) {
        if (interProblemSets.isEmpty()) {
            return List.of(Scenario.base());
        }
        Map<String, List<String>> items = new LinkedHashMap<>();
        interProblemSets.forEach(set -> items.put(set.getName(), set.getItems()));
        List<Scenario> scenarios = CartesianProduct.of(items).stream().map(Scenario::new).toList();
        log.info("Enumerated {} scenario(s) over inter-problem sets {}", scenarios.size(), items.keySet());
        return scenarios;
    }
}
