package com.convexlab.modeling.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;

import com.convexlab.modeling.exception.ModelDefinitionException;
import com.convexlab.modeling.exception.ModelValidationException;
import com.convexlab.modeling.model.DataTable;
import com.convexlab.modeling.model.IndexSet;
import com.convexlab.modeling.model.ModelDefinition;
import com.convexlab.modeling.model.ProblemDefinition;
import com.convexlab.modeling.model.SetFilter;
import com.convexlab.modeling.model.SetRole;
import com.convexlab.modeling.model.TableRole;
import com.convexlab.modeling.model.ValueType;
import com.convexlab.modeling.model.VariableDefinition;

/**
 * Reads a {@link ModelDefinition} from YAML with top-level {@code sets},
 * {@code tables} and {@code problems} sections.
 *
 * Every error found is collected and reported at once through a
 * {@link ModelValidationException}.
 */
public class ModelDefinitionLoader {
    private static final Logger log = LoggerFactory.getLogger(ModelDefinitionLoader.class);

    private static final String EXOGENOUS = "exogenous";
    private static final String ENDOGENOUS = "endogenous";
    private static final String CONSTANT = "constant";

    private final Load yaml = new Load(LoadSettings.builder().setLabel("model").build());

    public ModelDefinition load(Path file) throws IOException {
        log.info("Loading model definition from {}", file);
        return parse(Files.readString(file, StandardCharsets.UTF_8));
    }

    public ModelDefinition parse(String content) {
        Object document;
        try {
            document = yaml.loadFromString(content);
        } catch (YamlEngineException e) {
            throw new ModelDefinitionException("Malformed model definition: " + e.getMessage(), e);
        }
        if (!(document instanceof Map)) {
            throw new ModelDefinitionException("Model definition must be a mapping with 'sets', 'tables' and 'problems'");
        }
        Map<String, Object> root = asMap(document, "model", new ArrayList<>());

        List<String> errors = new ArrayList<>();
        ModelDefinition.ModelDefinitionBuilder builder = ModelDefinition.builder();

        Map<String, IndexSet> sets = parseSets(asMap(root.get("sets"), "sets", errors), errors);
        sets.values().forEach(set -> builder.set(set.getName(), set));

        Map<String, Object> tables = asMap(root.get("tables"), "tables", errors);
        Map<String, String> variableOwners = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : tables.entrySet()) {
            parseTable(entry.getKey(), asMap(entry.getValue(), "table '" + entry.getKey() + "'", errors), sets,
                    builder, variableOwners, errors);
        }

        Map<String, Object> problems = asMap(root.get("problems"), "problems", errors);
        for (Map.Entry<String, Object> entry : problems.entrySet()) {
            ProblemDefinition problem = parseProblem(entry.getKey(),
                    asMap(entry.getValue(), "problem '" + entry.getKey() + "'", errors), errors);
            if (problem != null) {
                builder.problem(problem.getName(), problem);
            }
        }

        if (!errors.isEmpty()) {
            errors.forEach(error -> log.error("  - {}", error));
            throw new ModelValidationException(errors);
        }

        ModelDefinition model = builder.build();
        checkProblemTables(model, errors);
        if (!errors.isEmpty()) {
            throw new ModelValidationException(errors);
        }
        log.info("Loaded model: {} set(s), {} table(s), {} variable(s), {} problem(s)", model.getSets().size(),
                model.getTables().size(), model.getVariables().size(), model.getProblems().size());
        return model;
    }

    private Map<String, IndexSet> parseSets(Map<String, Object> section, List<String> errors) {
        Map<String, IndexSet> sets = new LinkedHashMap<>();
        Map<String, String> copies = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : section.entrySet()) {
            String name = entry.getKey();
            String where = "set '" + name + "'";
            Map<String, Object> node = asMap(entry.getValue(), where, errors);

            IndexSet.IndexSetBuilder set = IndexSet.builder()
                    .name(name)
                    .role(asBoolean(node.get("split_problem"), where + " split_problem", errors)
                            ? SetRole.INTER_PROBLEM : SetRole.DIMENSION)
                    .description(asString(node.get("description")));

            String copyFrom = asString(node.get("copy_from"));
            List<String> items = asStringList(node.get("items"), where + " items", errors);
            if (copyFrom != null) {
                if (!items.isEmpty()) {
                    errors.add(where + " declares both 'items' and 'copy_from'");
                }
                copies.put(name, copyFrom);
                set.copyFrom(copyFrom);
            } else {
                if (items.isEmpty()) {
                    errors.add(where + " has no items");
                }
                if (items.stream().distinct().count() != items.size()) {
                    errors.add(where + " has duplicate items");
                }
                set.items(items);
            }

            Map<String, Object> filters = asMap(node.get("filters"), where + " filters", errors);
            for (Map.Entry<String, Object> filter : filters.entrySet()) {
                List<String> subset = asStringList(filter.getValue(), where + " filter '" + filter.getKey() + "'", errors);
                for (String item : subset) {
                    if (copyFrom == null && !items.contains(item)) {
                        errors.add(where + " filter '" + filter.getKey() + "' refers to unknown item '" + item + "'");
                    }
                }
                set.filter(filter.getKey(), subset);
            }
            sets.put(name, set.build());
        }

        copies.forEach((name, source) -> {
            IndexSet original = sets.get(source);
            if (original == null || original.getCopyFrom() != null) {
                errors.add("set '" + name + "' copies unknown or copied set '" + source + "'");
                return;
            }
            sets.put(name, sets.get(name).toBuilder().items(original.getItems()).build());
        });
        return sets;
    }

    private void parseTable(String name, Map<String, Object> node, Map<String, IndexSet> sets,
            ModelDefinition.ModelDefinitionBuilder builder, Map<String, String> variableOwners, List<String> errors) {
        String where = "table '" + name + "'";
        List<String> coordinates = asStringList(node.get("coordinates"), where + " coordinates", errors);
        for (String setName : coordinates) {
            if (!sets.containsKey(setName)) {
                errors.add(where + " uses unknown set '" + setName + "'");
            }
        }

        ValueType valueType = ValueType.REAL;
        if (asBoolean(node.get("binary"), where + " binary", errors)) {
            valueType = ValueType.BINARY;
        } else if (asBoolean(node.get("integer"), where + " integer", errors)) {
            valueType = ValueType.INTEGER;
        }

        TableRole role = parseRole(node.get("type"), asString(node.get("value")), where, errors);
        if (role == null) {
            return;
        }
        builder.table(name, DataTable.builder()
                .name(name)
                .coordinates(coordinates)
                .valueType(valueType)
                .role(role)
                .description(asString(node.get("description")))
                .build());

        Object variablesNode = node.get("variables");
        if (variablesNode == null) {
            addVariable(VariableDefinition.builder().name(name).table(name).build(), builder, variableOwners, errors);
            return;
        }
        Map<String, Object> variables = asMap(variablesNode, where + " variables", errors);
        for (Map.Entry<String, Object> entry : variables.entrySet()) {
            VariableDefinition variable = parseVariable(entry.getKey(), name,
                    asMap(entry.getValue(), "variable '" + entry.getKey() + "'", errors), sets, coordinates, errors);
            addVariable(variable, builder, variableOwners, errors);
        }
    }

    /**
     * Variable names are global across tables.
     */
    private void addVariable(VariableDefinition variable, ModelDefinition.ModelDefinitionBuilder builder,
            Map<String, String> variableOwners, List<String> errors) {
        String owner = variableOwners.putIfAbsent(variable.getName(), variable.getTable());
        if (owner != null) {
            errors.add("variable '" + variable.getName() + "' is declared by both table '" + owner
                    + "' and table '" + variable.getTable() + "'");
            return;
        }
        builder.variable(variable.getName(), variable);
    }

    private TableRole parseRole(Object type, String value, String where, List<String> errors) {
        if (type instanceof Map) {
            Map<String, TableRole> roles = new LinkedHashMap<>();
            asMap(type, where + " type", errors).forEach((problem, problemType) -> {
                TableRole role = simpleRole(asString(problemType), value, where + " type for '" + problem + "'", errors);
                if (role != null) {
                    roles.put(problem, role);
                }
            });
            return TableRole.perSubproblem(roles);
        }
        return simpleRole(asString(type), value, where, errors);
    }

    private TableRole simpleRole(String type, String value, String where, List<String> errors) {
        if (type == null || EXOGENOUS.equals(type)) {
            return TableRole.exogenous();
        }
        if (ENDOGENOUS.equals(type)) {
            return TableRole.endogenous();
        }
        if (CONSTANT.equals(type)) {
            if (value == null) {
                errors.add(where + " is constant but has no 'value' generator");
                return null;
            }
            return TableRole.constant(value);
        }
        errors.add(where + " has unknown type '" + type + "', expected exogenous, endogenous or constant");
        return null;
    }

    private VariableDefinition parseVariable(String name, String table, Map<String, Object> node,
            Map<String, IndexSet> sets, List<String> coordinates, List<String> errors) {
        String where = "variable '" + name + "'";
        VariableDefinition.VariableDefinitionBuilder variable = VariableDefinition.builder()
                .name(name)
                .table(table)
                .rows(asString(node.get("rows")))
                .cols(asString(node.get("cols")));
        if (node.containsKey("intra")) {
            variable.intra(asStringList(node.get("intra"), where + " intra", errors));
        }

        Object blankFill = node.get("blank_fill");
        if (blankFill instanceof Number) {
            variable.blankFill(((Number) blankFill).doubleValue());
        } else if (blankFill != null) {
            errors.add(where + " blank_fill must be a number");
        }

        Map<String, Object> filters = asMap(node.get("filters"), where + " filters", errors);
        for (Map.Entry<String, Object> filter : filters.entrySet()) {
            String setName = filter.getKey();
            if (!coordinates.contains(setName)) {
                errors.add(where + " filters set '" + setName + "' which is not a coordinate of table '" + table + "'");
                continue;
            }
            SetFilter parsed = parseFilter(filter.getValue(), where + " filter on '" + setName + "'", errors);
            IndexSet set = sets.get(setName);
            if (set != null) {
                parsed.getLabels().stream().filter(label -> !set.getFilters().containsKey(label))
                        .forEach(label -> errors.add(where + " uses unknown filter '" + label + "' of set '" + setName + "'"));
                parsed.getItems().stream().filter(item -> !set.contains(item))
                        .forEach(item -> errors.add(where + " filters unknown item '" + item + "' of set '" + setName + "'"));
            }
            variable.filter(setName, parsed);
        }
        return variable.build();
    }

    /**
     * A string is a filter label, a list holds explicit items, a mapping may carry both.
     */
    private SetFilter parseFilter(Object value, String where, List<String> errors) {
        if (value instanceof String) {
            return SetFilter.named((String) value);
        }
        if (value instanceof List) {
            return SetFilter.builder().items(asStringList(value, where, errors)).build();
        }
        Map<String, Object> node = asMap(value, where, errors);
        return SetFilter.builder()
                .labels(asStringList(node.get("labels"), where + " labels", errors))
                .items(asStringList(node.get("items"), where + " items", errors))
                .build();
    }

    private ProblemDefinition parseProblem(String name, Map<String, Object> node, List<String> errors) {
        String where = "problem '" + name + "'";
        List<String> expressions = asStringList(node.get("expressions"), where + " expressions", errors);
        List<String> objectives = asStringList(node.get("objective"), where + " objective", errors);
        Object order = node.get("coupling_order");
        if (order != null && !(order instanceof Integer)) {
            errors.add(where + " coupling_order must be an integer");
            order = null;
        }
        if (expressions.isEmpty() && objectives.isEmpty()) {
            errors.add(where + " declares no expressions");
            return null;
        }
        return ProblemDefinition.builder()
                .name(name)
                .expressions(expressions)
                .objectives(objectives)
                .optimize(node.containsKey("optimize") ? asBoolean(node.get("optimize"), where + " optimize", errors) : null)
                .couplingGroup(asString(node.get("coupling_group")))
                .couplingOrder((Integer) order)
                .description(asString(node.get("description")))
                .build();
    }

    private static void checkProblemTables(ModelDefinition model, List<String> errors) {
        for (DataTable table : model.getTables().values()) {
            if (table.getRole() instanceof TableRole.PerSubproblem) {
                ((TableRole.PerSubproblem) table.getRole()).getRoles().keySet().stream()
                        .filter(problem -> !model.getProblems().containsKey(problem))
                        .forEach(problem -> errors.add("table '" + table.getName()
                                + "' declares a type for unknown problem '" + problem + "'"));
            }
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value, String where, List<String> errors) {
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map)) {
            errors.add(where + " must be a mapping");
            return Map.of();
        }
        Map<String, Object> result = new LinkedHashMap<>();
        ((Map<Object, Object>) value).forEach((key, v) -> result.put(String.valueOf(key), v));
        return result;
    }

    private static List<String> asStringList(Object value, String where, List<String> errors) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof String) {
            return List.of((String) value);
        }
        if (!(value instanceof List)) {
            errors.add(where + " must be a list");
            return List.of();
        }
        List<String> result = new ArrayList<>();
        for (Object item : (List<?>) value) {
            result.add(String.valueOf(item));
        }
        return result;
    }

    private static String asString(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    private static boolean asBoolean(Object value, String where, List<String> errors) {
        if (value == null) {
            return false;
        }
        if (!(value instanceof Boolean)) {
            errors.add(where + " must be true or false");
            return false;
        }
        return (Boolean) value;
    }
}
