package com.recomart.recommendation.core;

import com.recomart.recommendation.config.RecommendationConfig;
import com.recomart.recommendation.exception.RecommendationException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns product text into a fixed-length vector with signed feature hashing.
 *
 * The text is lower-cased and split on every character that is not a letter or digit.
 * Each token adds {@value #TOKEN_WEIGHT} to one bucket, and each character trigram of the
 * token padded as {@code #token#} adds {@value #TRIGRAM_WEIGHT}. The bucket and the sign
 * of a feature come from a salted 32-bit FNV-1a hash of its UTF-8 bytes, finished with the
 * murmur3 avalanche step. Output depends only on the text, the dimensions and the salt.
 * Blank text maps to the zero vector.
 */
@Component
public class FeatureVectorizer {

    static final float TOKEN_WEIGHT = 1.0f;
    static final float TRIGRAM_WEIGHT = 0.5f;

    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[^\\p{L}\\p{Nd}]+");
    private static final int FNV_OFFSET_BASIS = 0x811C9DC5;
    private static final int FNV_PRIME = 0x01000193;

    // Trigrams are hashed in their own namespace so "red" the token and "red" the trigram differ
    private static final String TRIGRAM_PREFIX = "3:";

    private final int dimensions;
    private final int salt;

    @Autowired
    public FeatureVectorizer(RecommendationConfig config) {
        this(config.getVector().getDimensions(), config.getVector().getHashSalt());
    }

    public FeatureVectorizer(int dimensions, int salt) {
        if (dimensions <= 0) {
            throw RecommendationException.invalidArgument("Vector dimensions must be positive, got " + dimensions);
        }
        this.dimensions = dimensions;
        this.salt = salt;
    }

    public int getDimensions() {
        return dimensions;
    }

    public float[] vectorize(String text) {
        float[] vector = new float[dimensions];
        if (text == null || text.isBlank()) {
            return vector;
        }

        for (String token : TOKEN_SEPARATOR.split(text.toLowerCase(Locale.ROOT))) {
            if (token.isEmpty()) {
                continue;
            }
            accumulate(vector, token, TOKEN_WEIGHT);

            String padded = "#" + token + "#";
            for (int i = 0; i + 3 <= padded.length(); i++) {
                accumulate(vector, TRIGRAM_PREFIX + padded.substring(i, i + 3), TRIGRAM_WEIGHT);
            }
        }
        return vector;
    }

    private void accumulate(float[] vector, String feature, float weight) {
        int hash = hash(feature);
        int bucket = (hash & 0x7FFFFFFF) % dimensions;
        vector[bucket] += (hash < 0) ? -weight : weight;
    }

    int hash(String feature) {
        int h = FNV_OFFSET_BASIS;
        for (int shift = 0; shift < 32; shift += 8) {
            h ^= (salt >>> shift) & 0xFF;
            h *= FNV_PRIME;
        }
        for (byte b : feature.getBytes(StandardCharsets.UTF_8)) {
            h ^= b & 0xFF;
            h *= FNV_PRIME;
        }
        h ^= h >>> 16;
        h *= 0x85EBCA6B;
        h ^= h >>> 13;
        h *= 0xC2B2AE35;
        h ^= h >>> 16;
        return h;
    }
}
