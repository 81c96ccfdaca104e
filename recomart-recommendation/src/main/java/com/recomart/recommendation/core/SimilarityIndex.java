package com.recomart.recommendation.core;

import com.recomart.recommendation.dto.ProductText;
import com.recomart.recommendation.dto.SimilarProduct;
import com.recomart.recommendation.exception.RecommendationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory product vectors with cosine nearest-neighbour lookup.
 *
 * All state lives in an immutable snapshot. {@link #rebuild}, {@link #upsert} and
 * {@link #remove} build a new snapshot and publish it with a single reference swap,
 * so readers always see a complete index and never take a lock.
 */
@Slf4j
@Component
public class SimilarityIndex {

    private final FeatureVectorizer vectorizer;
    private final AtomicReference<Snapshot> current = new AtomicReference<>(Snapshot.EMPTY);

    public SimilarityIndex(FeatureVectorizer vectorizer) {
        this.vectorizer = vectorizer;
    }

    /**
     * Replace the whole index. When an id occurs twice, the later text wins and the id
     * keeps the position of its first occurrence.
     */
    public void rebuild(List<ProductText> products) {
        LinkedHashMap<String, float[]> vectors = new LinkedHashMap<>();
        for (ProductText product : products) {
            vectors.put(product.productId(), vectorizer.vectorize(product.text()));
        }
        current.set(Snapshot.of(vectors));
        log.info("Rebuilt similarity index: {} products, {} dimensions", vectors.size(), vectorizer.getDimensions());
    }

    /**
     * Add or refresh one product. A new id goes to the end of the insertion order.
     */
    public void upsert(String productId, String text) {
        float[] vector = vectorizer.vectorize(text);
        current.updateAndGet(snapshot -> snapshot.with(productId, vector));
        log.debug("Upserted product into similarity index: {}", productId);
    }

    public void remove(String productId) {
        current.updateAndGet(snapshot -> snapshot.without(productId));
        log.debug("Removed product from similarity index: {}", productId);
    }

    public boolean contains(String productId) {
        return current.get().positions.containsKey(productId);
    }

    public int size() {
        return current.get().ids.size();
    }

    public int dimensions() {
        return vectorizer.getDimensions();
    }

    // Copy of the stored vector, for checks within this package.
    Optional<float[]> getVector(String productId) {
        Snapshot snapshot = current.get();
        Integer position = snapshot.positions.get(productId);
        if (position == null) {
            return Optional.empty();
        }
        return Optional.of(snapshot.vectors[position].clone());
    }

    /**
     * Ids of the {@code topN} products most similar to {@code productId}, best first.
     */
    public List<String> nearestNeighbors(String productId, int topN) {
        return scoredNeighbors(productId, topN).stream()
                .map(SimilarProduct::getProductId)
                .toList();
    }

    /**
     * Up to {@code topN} other products ranked by descending cosine similarity to
     * {@code productId}. Equal scores keep insertion order.
     *
     * @throws RecommendationException INVALID_ARGUMENT when topN is not positive,
     *                                 PRODUCT_NOT_INDEXED when the product is unknown
     */
    public List<SimilarProduct> scoredNeighbors(String productId, int topN) {
        if (topN <= 0) {
            throw RecommendationException.invalidArgument("topN must be positive, got " + topN);
        }

        Snapshot snapshot = current.get();
        Integer query = snapshot.positions.get(productId);
        if (query == null) {
            throw RecommendationException.productNotIndexed(productId);
        }

        float[] queryVector = snapshot.vectors[query];
        double queryNorm = snapshot.norms[query];

        List<SimilarProduct> candidates = new ArrayList<>(Math.max(0, snapshot.ids.size() - 1));
        for (int i = 0; i < snapshot.ids.size(); i++) {
            if (i == query) {
                continue;
            }
            double score = cosine(queryVector, queryNorm, snapshot.vectors[i], snapshot.norms[i]);
            candidates.add(new SimilarProduct(snapshot.ids.get(i), score));
        }

        // List.sort is stable, which keeps insertion order among equal scores
        candidates.sort(Comparator.comparingDouble(SimilarProduct::getSimilarityScore).reversed());
        return candidates.size() > topN ? List.copyOf(candidates.subList(0, topN)) : List.copyOf(candidates);
    }

    /**
     * dot(u, v) / (|u| * |v|), or 0 when either vector has zero norm.
     */
    public static double cosineSimilarity(float[] u, float[] v) {
        if (u.length != v.length) {
            throw RecommendationException.invalidArgument(
                    "Vector lengths differ: " + u.length + " vs " + v.length);
        }
        return cosine(u, norm(u), v, norm(v));
    }

    private static double cosine(float[] u, double normU, float[] v, double normV) {
        if (normU == 0.0 || normV == 0.0) {
            return 0.0;
        }
        double dot = 0.0;
        for (int i = 0; i < u.length; i++) {
            dot += (double) u[i] * v[i];
        }
        double similarity = dot / (normU * normV);
        return Math.max(-1.0, Math.min(1.0, similarity));
    }

    private static double norm(float[] vector) {
        double sum = 0.0;
        for (float component : vector) {
            sum += (double) component * component;
        }
        return Math.sqrt(sum);
    }

    private static final class Snapshot {

        static final Snapshot EMPTY = new Snapshot(List.of(), new float[0][], new double[0]);

        final List<String> ids;
        final float[][] vectors;
        final double[] norms;
        final Map<String, Integer> positions;

        private Snapshot(List<String> ids, float[][] vectors, double[] norms) {
            this.ids = ids;
            this.vectors = vectors;
            this.norms = norms;
            Map<String, Integer> byId = new HashMap<>();
            for (int i = 0; i < ids.size(); i++) {
                byId.put(ids.get(i), i);
            }
            this.positions = Collections.unmodifiableMap(byId);
        }

        static Snapshot of(LinkedHashMap<String, float[]> entries) {
            List<String> ids = new ArrayList<>(entries.size());
            float[][] vectors = new float[entries.size()][];
            double[] norms = new double[entries.size()];
            int i = 0;
            for (Map.Entry<String, float[]> entry : entries.entrySet()) {
                ids.add(entry.getKey());
                vectors[i] = entry.getValue();
                norms[i] = norm(entry.getValue());
                i++;
            }
            return new Snapshot(Collections.unmodifiableList(ids), vectors, norms);
        }

        Snapshot with(String productId, float[] vector) {
            LinkedHashMap<String, float[]> entries = toEntries();
            entries.put(productId, vector);
            return of(entries);
        }

        Snapshot without(String productId) {
            if (!positions.containsKey(productId)) {
                return this;
            }
            LinkedHashMap<String, float[]> entries = toEntries();
            entries.remove(productId);
            return of(entries);
        }

        private LinkedHashMap<String, float[]> toEntries() {
            LinkedHashMap<String, float[]> entries = new LinkedHashMap<>();
            for (int i = 0; i < ids.size(); i++) {
                entries.put(ids.get(i), vectors[i]);
            }
            return entries;
        }
    }
}
