package com.memorybox.embed;

public final class Vectors {
    private Vectors() {
    }

    /** Scales the vector to unit length in place; a zero vector is returned unchanged. */
    public static float[] normalize(float[] vector) {
        float norm = 0f;
        for (float value : vector) {
            norm += value * value;
        }
        norm = (float) Math.sqrt(norm);
        if (norm <= 0f) {
            return vector;
        }
        for (int i = 0; i < vector.length; i++) {
            vector[i] /= norm;
        }
        return vector;
    }

    /** Squared Euclidean distance. */
    public static float l2Squared(float[] a, float[] b) {
        float sum = 0f;
        for (int i = 0; i < a.length; i++) {
            float diff = a[i] - b[i];
            sum += diff * diff;
        }
        return sum;
    }

    public static boolean isEmpty(float[] vector) {
        return vector == null || vector.length == 0;
    }
}
