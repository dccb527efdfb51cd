package com.quoteflow.embedding;

public final class Vectors {
    private Vectors() {
    }

    public static float cosine(float[] a, float[] b) {
        if (a == null || b == null) {
            return 0f;
        }
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

    public static boolean isEmpty(float[] vector) {
        if (vector == null || vector.length == 0) {
            return true;
        }
        for (float value : vector) {
            if (value != 0f) {
                return false;
            }
        }
        return true;
    }
}
