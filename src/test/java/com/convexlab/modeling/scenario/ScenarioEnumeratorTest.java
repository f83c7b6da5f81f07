package com.convexlab.modeling.scenario;

import com.convexlab.modeling.model.Coordinate;
import com.convexlab.modeling.model.IndexSet;
import com.convexlab.modeling.model.SetRole;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ScenarioEnumeratorTest {

    private final ScenarioEnumerator enumerator = new ScenarioEnumerator();

    @Test
    void testNoInterProblemSetsGivesBaseScenario() {
        List<Scenario> scenarios = enumerator.enumerate(List.of());

        assertThat(scenarios).containsExactly(Scenario.base());
        assertThat(scenarios.get(0).isBase()).isTrue();
        assertThat(scenarios.get(0).key()).isEqualTo("base");
    }

    @Test
    void testScenariosAreCartesianProductInDeclaredOrder() {
        IndexSet year = IndexSet.builder().name("year").items(List.of("2030", "2040"))
                .role(SetRole.INTER_PROBLEM).build();
        IndexSet weather = IndexSet.builder().name("weather").items(List.of("dry", "wet", "avg"))
                .role(SetRole.INTER_PROBLEM).build();

        List<Scenario> scenarios = enumerator.enumerate(List.of(year, weather));

        assertThat(scenarios).hasSize(6);
        assertThat(scenarios.get(0).getCoordinate())
                .isEqualTo(Coordinate.of(Map.of("year", "2030", "weather", "dry")));
        assertThat(scenarios.get(5).getCoordinate())
                .isEqualTo(Coordinate.of(Map.of("year", "2040", "weather", "avg")));
        assertThat(scenarios).doesNotHaveDuplicates();
    }
}
