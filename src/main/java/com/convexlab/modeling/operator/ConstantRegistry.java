package com.convexlab.modeling.operator;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiFunction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.convexlab.modeling.algebra.Shape;
import com.convexlab.modeling.exception.ModelDefinitionException;

/**
 * Name to {@link ConstantGenerator} lookup for constant tables.
 */
public class ConstantRegistry {
    private static final Logger log = LoggerFactory.getLogger(ConstantRegistry.class);

    private final Map<String, ConstantGenerator> generators = new LinkedHashMap<>();

    /**
     * Registry holding the built-in constants.
     */
    public static ConstantRegistry withDefaults() {
        ConstantRegistry registry = new ConstantRegistry();
        registry.register(vectorOnly("sum_vector", (rows, cols) -> Shape.of(rows, cols, true), (rows, cols) -> {
            double[][] ones = new double[rows][cols];
            for (double[] row : ones) {
                Arrays.fill(row, 1.0);
            }
            return ones;
        }));
        registry.register(vectorOnly("identity", ConstantRegistry::squareOfLength, (rows, cols) -> {
            int n = Math.max(rows, cols);
            double[][] eye = new double[n][n];
            for (int i = 0; i < n; i++) {
                eye[i][i] = 1.0;
            }
            return eye;
        }));
        registry.register(vectorOnly("set_length", (rows, cols) -> Shape.scalar(),
                (rows, cols) -> new double[][] { { Math.max(rows, cols) } }));
        registry.register(range("arange_0", 0));
        registry.register(range("arange_1", 1));
        registry.register(vectorOnly("lower_triangular", ConstantRegistry::squareOfLength, (rows, cols) -> {
            int n = Math.max(rows, cols);
            double[][] tril = new double[n][n];
            for (int i = 0; i < n; i++) {
                for (int j = 0; j <= i; j++) {
                    tril[i][j] = 1.0;
                }
            }
            return tril;
        }));
        return registry;
    }

    public synchronized ConstantRegistry register(ConstantGenerator generator) {
        if (generators.put(generator.getName(), generator) != null) {
            log.warn("Constant '{}' replaced", generator.getName());
        }
        return this;
    }

    public synchronized Optional<ConstantGenerator> find(String name) {
        return Optional.ofNullable(generators.get(name));
    }

    public ConstantGenerator get(String name) {
        return find(name).orElseThrow(() -> new ModelDefinitionException("Unknown constant '" + name
                + "'. Available constants: " + names()));
    }

    public synchronized Set<String> names() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(generators.keySet()));
    }

    private static Shape squareOfLength(int rows, int cols) {
        int n = Math.max(rows, cols);
        return Shape.of(n, n, true);
    }

    /**
     * Generator accepting vector shapes only.
     */
    private static ConstantGenerator vectorOnly(String name, BiFunction<Integer, Integer, Shape> shape,
            BiFunction<Integer, Integer, double[][]> values) {
        return new ConstantGenerator() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public Shape outputShape(int rows, int cols) {
                if (rows != 1 && cols != 1) {
                    throw new ModelDefinitionException("Constant '" + name
                            + "' can be defined for vectors only, got (" + rows + "x" + cols + ")");
                }
                return shape.apply(rows, cols);
            }

            @Override
            public double[][] generate(int rows, int cols) {
                outputShape(rows, cols);
                return values.apply(rows, cols);
            }
        };
    }

    /**
     * Column-major range starting at {@code start}.
     */
    private static ConstantGenerator range(String name, int start) {
        return new ConstantGenerator() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public Shape outputShape(int rows, int cols) {
                return Shape.of(rows, cols, true);
            }

            @Override
            public double[][] generate(int rows, int cols) {
                double[][] values = new double[rows][cols];
                int next = start;
                for (int j = 0; j < cols; j++) {
                    for (int i = 0; i < rows; i++) {
                        values[i][j] = next++;
                    }
                }
                return values;
            }
        };
    }
}
