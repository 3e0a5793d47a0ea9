package br.edu.ifba.videorag.adapters;

import br.edu.ifba.videorag.embedding.EmbeddingException;

import java.util.List;

final class VectorConversions {

    private VectorConversions() {
        throw new UnsupportedOperationException("Utility class");
    }

    static float[] toFloatArray(final List<Double> values) {
        if (values == null || values.isEmpty()) {
            throw new EmbeddingException("Embedding API returned null or empty vector");
        }
        final float[] vector = new float[values.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = values.get(i).floatValue();
        }
        return vector;
    }
}
