package com.tierstore.store;

import java.util.Map;

public final class VectorMath {
    private VectorMath() {
    }

    public static float similarity(DistanceMetric metric, float[] a, float[] b) {
        return switch (metric) {
            case COSINE -> cosine(a, b);
            case IP -> dot(a, b);
            case L2 -> (float) (1.0 / (1.0 + Math.sqrt(squaredDistance(a, b))));
        };
    }

    public static float cosine(float[] a, float[] b) {
        int len = Math.min(a.length, b.length);
        float dot = 0f;
        float aNorm = 0f;
        float bNorm = 0f;
        for (int i = 0; i < len; i++) {
            dot += a[i] * b[i];
            aNorm += a[i] * a[i];
            bNorm += b[i] * b[i];
        }
        if (aNorm == 0f || bNorm == 0f) {
            return 0f;
        }
        return (float) (dot / Math.sqrt(aNorm * bNorm));
    }

    public static float dot(float[] a, float[] b) {
        int len = Math.min(a.length, b.length);
        float dot = 0f;
        for (int i = 0; i < len; i++) {
            dot += a[i] * b[i];
        }
        return dot;
    }

    public static float sparseDot(Map<String, Float> a, Map<String, Float> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0f;
        }
        Map<String, Float> small = a.size() <= b.size() ? a : b;
        Map<String, Float> large = small == a ? b : a;
        float dot = 0f;
        for (Map.Entry<String, Float> entry : small.entrySet()) {
            Float other = large.get(entry.getKey());
            if (other != null) {
                dot += entry.getValue() * other;
            }
        }
        return dot;
    }

    public static void normalize(float[] vector) {
        float norm = 0f;
        for (float value : vector) {
            norm += value * value;
        }
        norm = (float) Math.sqrt(norm);
        if (norm <= 0f) {
            return;
        }
        for (int i = 0; i < vector.length; i++) {
            vector[i] /= norm;
        }
    }

    private static double squaredDistance(float[] a, float[] b) {
        int len = Math.min(a.length, b.length);
        double sum = 0d;
        for (int i = 0; i < len; i++) {
            double diff = a[i] - b[i];
            sum += diff * diff;
        }
        return sum;
    }
}
