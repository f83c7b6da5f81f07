package com.convexlab.modeling.report;

import com.convexlab.modeling.orchestration.CouplingState;
import com.convexlab.modeling.orchestration.RunReport;
import com.convexlab.modeling.orchestration.SolveMode;
import com.convexlab.modeling.orchestration.UnitStatus;
import freemarker.template.TemplateException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class RunReportRendererTest {

    @TempDir
    Path tempDir;

    private final RunReportRenderer renderer = new RunReportRenderer();

    private static RunReport report() {
        RunReport report = new RunReport(SolveMode.INTEGRATED, Instant.parse("2026-01-01T00:00:00Z"));
        report.setDurationMillis(42);
        report.getUnits().add(UnitStatus.builder()
                .scenario("{year=2030}").unit("dispatch").kind(UnitStatus.Kind.PROBLEM)
                .status(UnitStatus.Status.SOLVED).objectiveValue(2600.0).build());
        Map<String, Double> members = new LinkedHashMap<>();
        members.put("producer", null);
        members.put("consumer", 12.5);
        report.getUnits().add(UnitStatus.builder()
                .scenario("{year=2030}").unit("loop").kind(UnitStatus.Kind.COUPLING_GROUP)
                .status(UnitStatus.Status.NOT_CONVERGED).iterations(5).finalNorm(0.25)
                .couplingState(CouplingState.MAX_ITER_EXCEEDED).memberObjectives(members)
                .errorMessage("Coupling group 'loop' did not converge").build());
        report.getUnits().add(UnitStatus.builder()
                .scenario("{year=2040}").unit("dispatch").kind(UnitStatus.Kind.PROBLEM)
                .status(UnitStatus.Status.INFEASIBLE).errorMessage("Problem 'dispatch' infeasible").build());
        return report;
    }

    @Test
    void testRenderGroupsUnitsByScenario() throws IOException, TemplateException {
        String text = renderer.render(report());

        assertThat(text)
                .contains("Run Report (INTEGRATED)")
                .contains("Started:  2026-01-01T00:00:00Z")
                .contains("Duration: 42 ms")
                .contains("FAILURES PRESENT")
                .contains("SOLVED: 1")
                .contains("NOT_CONVERGED: 1")
                .contains("INFEASIBLE: 1")
                .doesNotContain("SKIPPED:")
                .contains("dispatch [PROBLEM] SOLVED objective=2600")
                .contains("iterations=5")
                .contains("state=MAX_ITER_EXCEEDED")
                .contains("producer: -")
                .contains("consumer: 12.5")
                .contains("error: Problem 'dispatch' infeasible");
        assertThat(text.indexOf("Scenario: {year=2030}")).isLessThan(text.indexOf("Scenario: {year=2040}"));
    }

    @Test
    void testAllSolvedBanner() throws IOException, TemplateException {
        RunReport report = new RunReport(SolveMode.INDEPENDENT, Instant.now());
        report.getUnits().add(UnitStatus.skipped("base", "loop", "coupled"));

        assertThat(renderer.render(report)).contains("ALL UNITS SOLVED").contains("SKIPPED: 1");
    }

    @Test
    void testWriteCreatesParentDirectories() throws IOException, TemplateException {
        Path file = tempDir.resolve("out/nested/run-report.txt");

        renderer.write(report(), file);

        assertThat(file).exists();
        assertThat(Files.readString(file)).contains("Run Report (INTEGRATED)");
    }
}
