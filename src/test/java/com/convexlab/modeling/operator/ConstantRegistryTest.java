package com.convexlab.modeling.operator;

import com.convexlab.modeling.algebra.Shape;
import com.convexlab.modeling.exception.ModelDefinitionException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ConstantRegistryTest {

    private final ConstantRegistry registry = ConstantRegistry.withDefaults();

    @Test
    void testSumVectorIsOnesOfSameShape() {
        ConstantGenerator ones = registry.get("sum_vector");

        assertThat(ones.outputShape(1, 3)).isEqualTo(Shape.of(1, 3, true));
        assertThat(ones.generate(3, 1)).isEqualTo(new double[][] { { 1 }, { 1 }, { 1 } });
    }

    @Test
    void testIdentityIsSquareOfVectorLength() {
        assertThat(registry.get("identity").outputShape(3, 1)).isEqualTo(Shape.of(3, 3, true));
        assertThat(registry.get("identity").generate(1, 2)).isEqualTo(new double[][] { { 1, 0 }, { 0, 1 } });
    }

    @Test
    void testSetLengthIsScalar() {
        assertThat(registry.get("set_length").outputShape(4, 1)).isEqualTo(Shape.scalar());
        assertThat(registry.get("set_length").generate(4, 1)).isEqualTo(new double[][] { { 4 } });
    }

    @Test
    void testLowerTriangular() {
        assertThat(registry.get("lower_triangular").generate(3, 1))
                .isEqualTo(new double[][] { { 1, 0, 0 }, { 1, 1, 0 }, { 1, 1, 1 } });
    }

    @Test
    void testRangesAreColumnMajor() {
        assertThat(registry.get("arange_0").generate(2, 2)).isEqualTo(new double[][] { { 0, 2 }, { 1, 3 } });
        assertThat(registry.get("arange_1").generate(1, 3)).isEqualTo(new double[][] { { 1, 2, 3 } });
    }

    @Test
    void testVectorOnlyConstantRejectsMatrix() {
        assertThatThrownBy(() -> registry.get("identity").outputShape(2, 3))
                .isInstanceOf(ModelDefinitionException.class)
                .hasMessageContaining("vectors only");
    }

    @Test
    void testUnknownConstantFails() {
        assertThatThrownBy(() -> registry.get("weibull"))
                .isInstanceOf(ModelDefinitionException.class)
                .hasMessageContaining("weibull");
    }
}
