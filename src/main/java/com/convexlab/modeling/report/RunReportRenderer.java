package com.convexlab.modeling.report;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.convexlab.modeling.orchestration.RunReport;
import com.convexlab.modeling.orchestration.UnitStatus;
import com.convexlab.util.FileWriteUtil;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders a {@link RunReport} as a plain-text summary from the
 * {@code run-report.ftl} template.
 */
public class RunReportRenderer {
    private static final Logger log = LoggerFactory.getLogger(RunReportRenderer.class);

    static final String TEMPLATE = "run-report.ftl";

    private final Configuration freemarkerConfig;

    public RunReportRenderer() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public String render(RunReport report) throws IOException, TemplateException {
        Template template = freemarkerConfig.getTemplate(TEMPLATE);
        StringWriter out = new StringWriter();
        template.process(dataModel(report), out);
        return out.toString();
    }

    public void write(RunReport report, Path file) throws IOException, TemplateException {
        FileWriteUtil.safeWriteString(file, render(report));
        log.info("Run report written to {}", file);
    }

    private Map<String, Object> dataModel(RunReport report) {
        Map<String, Object> model = new LinkedHashMap<>();
        model.put("report", report);
        model.put("mode", report.getMode().name());
        model.put("startedAt", report.getStartedAt().toString());
        model.put("allSolved", report.isAllSolved());

        Map<String, List<UnitStatus>> byScenario = report.getUnits().stream()
                .collect(Collectors.groupingBy(UnitStatus::getScenario, LinkedHashMap::new, Collectors.toList()));
        model.put("scenarios", byScenario);

        Map<String, Long> counts = new LinkedHashMap<>();
        for (UnitStatus.Status status : UnitStatus.Status.values()) {
            long count = report.count(status);
            if (count > 0) {
                counts.put(status.name(), count);
            }
        }
        model.put("counts", counts);
        return model;
    }
}
