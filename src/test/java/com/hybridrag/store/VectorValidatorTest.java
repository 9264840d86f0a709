package com.hybridrag.store;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.hybridrag.error.DimensionMismatchException;
import com.hybridrag.error.ValidationException;

class VectorValidatorTest {

    @Test
    void shouldConvertNumericListToFloats() {
        float[] vector = VectorValidator.validate(List.of(1, 0.5, 2L), 3);

        assertArrayEquals(new float[] { 1f, 0.5f, 2f }, vector);
    }

    @Test
    void shouldReportExpectedAndActualDimension() {
        DimensionMismatchException error = assertThrows(DimensionMismatchException.class,
                () -> VectorValidator.validate(List.of(1.0, 2.0), 3));

        assertEquals(3, error.details().get("expected"));
        assertEquals(2, error.details().get("actual"));
    }

    @Test
    void shouldRejectNonNumericAndNonFiniteElements() {
        DimensionMismatchException wrongType = assertThrows(DimensionMismatchException.class,
                () -> VectorValidator.validate(List.of(1.0, "x"), 2));
        assertEquals(1, wrongType.details().get("index"));
        assertThrows(ValidationException.class, () -> VectorValidator.validate(new float[] { 1f, Float.NaN }, 2));
        assertThrows(ValidationException.class,
                () -> VectorValidator.validate(new float[] { Float.POSITIVE_INFINITY, 1f }, 2));
        assertThrows(ValidationException.class, () -> VectorValidator.validate(List.of(), 2));
    }
}
