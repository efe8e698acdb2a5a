package era.rank.base;

import java.util.List;

public class Embeddings {
    private Embeddings() {}

    public static float[] l2Normalize(float[] vector) {
        double sum = 0.0;
        for (float v : vector) {
            sum += (double) v * v;
        }
        float[] normalized = new float[vector.length];
        if (sum <= 0.0) {
            return normalized;
        }
        double norm = Math.sqrt(sum);
        for (int i = 0; i < vector.length; i++) {
            normalized[i] = (float) (vector[i] / norm);
        }
        return normalized;
    }

    public static double similarity(float[] a, float[] b) {
        if (a == null || b == null || a.length != b.length) {
            return 0.0;
        }
        double dot = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
        }
        return dot;
    }

    public static List<Double> toList(float[] vector) {
        Double[] boxed = new Double[vector.length];
        for (int i = 0; i < vector.length; i++) {
            boxed[i] = (double) vector[i];
        }
        return List.of(boxed);
    }

    public static float[] fromList(List<?> values) {
        float[] vector = new float[values.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = ((Number) values.get(i)).floatValue();
        }
        return vector;
    }
}
