package com.hybridrag.store;

import java.util.List;
import java.util.Map;

import com.hybridrag.error.DimensionMismatchException;
import com.hybridrag.error.ValidationException;

public final class VectorValidator {
    private VectorValidator() {
    }

    public static float[] validate(List<?> raw, int dimension) {
        if (raw == null || raw.isEmpty()) {
            throw new ValidationException("Vector must be a non-empty list of numbers");
        }
        float[] vector = new float[raw.size()];
        for (int i = 0; i < raw.size(); i++) {
            Object value = raw.get(i);
            if (!(value instanceof Number number)) {
                throw new DimensionMismatchException("Vector element " + i + " is not a number: " + value,
                        Map.of("index", i));
            }
            vector[i] = number.floatValue();
        }
        return validate(vector, dimension);
    }

    public static float[] validate(float[] vector, int dimension) {
        if (vector == null || vector.length == 0) {
            throw new ValidationException("Vector must be a non-empty list of numbers");
        }
        if (vector.length != dimension) {
            throw new DimensionMismatchException(
                    "Vector dimension mismatch: expected " + dimension + ", got " + vector.length,
                    Map.of("expected", dimension, "actual", vector.length));
        }
        for (int i = 0; i < vector.length; i++) {
            if (Float.isNaN(vector[i]) || Float.isInfinite(vector[i])) {
                throw new ValidationException("Vector element " + i + " is not finite", Map.of("index", i));
            }
        }
        return vector;
    }
}
