package com.tierstore.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.tierstore.store.VectorMath;

/**
 * Offline dense embeddings from hashed token and character-trigram features. Images hash their
 * byte windows.
 */
public class HashingEmbeddingProvider implements EmbeddingProvider {
    private final int dimension;

    public HashingEmbeddingProvider(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive: " + dimension);
        }
        this.dimension = dimension;
    }

    @Override
    public String modelId() {
        return "hashing-v1-" + dimension;
    }

    @Override
    public EmbeddingKind kind() {
        return EmbeddingKind.DENSE;
    }

    @Override
    public List<EmbeddingVector> embed(List<ModelInput> inputs) {
        List<EmbeddingVector> vectors = new ArrayList<>(inputs.size());
        for (ModelInput input : inputs) {
            float[] vector = input.isImage() ? embedImage(input.image()) : embedText(input.text());
            vectors.add(EmbeddingVector.dense(vector, modelId()));
        }
        return vectors;
    }

    float[] embedText(String text) {
        float[] vector = new float[dimension];
        if (text == null || text.isBlank()) {
            return vector;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("\\W+")) {
            if (token.isBlank()) {
                continue;
            }
            addHashed(vector, "tok:" + token, 1.0f);
            if (token.length() >= 3) {
                for (int i = 0; i <= token.length() - 3; i++) {
                    addHashed(vector, "tri:" + token.substring(i, i + 3), 0.35f);
                }
            }
        }
        VectorMath.normalize(vector);
        return vector;
    }

    private float[] embedImage(byte[] image) {
        float[] vector = new float[dimension];
        for (int i = 0; i + 4 <= image.length; i += 4) {
            int window = ((image[i] & 0xFF) << 24) | ((image[i + 1] & 0xFF) << 16)
                    | ((image[i + 2] & 0xFF) << 8) | (image[i + 3] & 0xFF);
            vector[Math.floorMod(Integer.hashCode(window * 31 + i % 97), dimension)] += 1f;
        }
        VectorMath.normalize(vector);
        return vector;
    }

    private void addHashed(float[] vector, String key, float weight) {
        int index = Math.floorMod(key.hashCode(), vector.length);
        vector[index] += weight;
    }
}
