package com.recomart.recommendation.core;

import com.recomart.recommendation.dto.ProductText;
import com.recomart.recommendation.dto.SimilarProduct;
import com.recomart.recommendation.exception.RecommendationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class SimilarityIndexTest {

    private SimilarityIndex index;

    @BeforeEach
    void setUp() {
        index = new SimilarityIndex(new FeatureVectorizer(128, 0x5EED));
    }

    @Test
    void sharedWordsRankAboveUnrelatedProduct() {
        index.rebuild(List.of(
                new ProductText("A", "red shoes"),
                new ProductText("B", "red shoes running"),
                new ProductText("C", "blue hat")));

        assertThat(index.nearestNeighbors("A", 2)).containsExactly("B", "C");
    }

    @Test
    void queryProductIsNeverItsOwnNeighbour() {
        index.rebuild(List.of(
                new ProductText("A", "same words"),
                new ProductText("B", "same words")));

        assertThat(index.nearestNeighbors("A", 5)).containsExactly("B");
    }

    @Test
    void equalScoresKeepInsertionOrder() {
        index.rebuild(List.of(
                new ProductText("X", "identical text"),
                new ProductText("Z", "identical text"),
                new ProductText("Y", "identical text")));

        assertThat(index.nearestNeighbors("X", 2)).containsExactly("Z", "Y");
        assertThat(index.nearestNeighbors("Y", 2)).containsExactly("X", "Z");
    }

    @Test
    void resultIsTruncatedToTopN() {
        index.rebuild(List.of(
                new ProductText("P1", "running shoes"),
                new ProductText("P2", "running shoes fitness"),
                new ProductText("P3", "running socks"),
                new ProductText("P4", "trail running shoes")));

        assertThat(index.nearestNeighbors("P1", 2)).hasSize(2);
        assertThat(index.nearestNeighbors("P1", 10)).hasSize(3);
    }

    @Test
    void scoresAreDescendingAndWithinRange() {
        index.rebuild(List.of(
                new ProductText("P1", "wireless headphones audio bluetooth"),
                new ProductText("P2", "bluetooth speaker audio"),
                new ProductText("P3", "running shoes"),
                new ProductText("P4", "wireless headphones")));

        List<SimilarProduct> hits = index.scoredNeighbors("P1", 3);

        assertThat(hits).hasSize(3);
        for (int i = 1; i < hits.size(); i++) {
            assertThat(hits.get(i - 1).getSimilarityScore()).isGreaterThanOrEqualTo(hits.get(i).getSimilarityScore());
        }
        assertThat(hits).allSatisfy(hit -> assertThat(hit.getSimilarityScore()).isBetween(-1.0, 1.0));
    }

    @Test
    void onlyProductInIndexHasNoNeighbours() {
        index.rebuild(List.of(new ProductText("A", "lonely product")));

        assertThat(index.nearestNeighbors("A", 3)).isEmpty();
    }

    @Test
    void nonPositiveTopNIsRejected() {
        index.rebuild(List.of(new ProductText("A", "red shoes")));

        assertThatThrownBy(() -> index.nearestNeighbors("A", 0))
                .isInstanceOf(RecommendationException.class)
                .extracting("errorCode").isEqualTo("INVALID_ARGUMENT");
    }

    @Test
    void unknownProductIsNotFound() {
        assertThatThrownBy(() -> index.nearestNeighbors("missing", 3))
                .isInstanceOf(RecommendationException.class)
                .extracting("errorCode").isEqualTo("PRODUCT_NOT_INDEXED");
    }

    @Test
    void rebuildWithDuplicateIdKeepsLastTextAtFirstPosition() {
        index.rebuild(List.of(
                new ProductText("A", "old text"),
                new ProductText("B", "other"),
                new ProductText("A", "red shoes")));

        assertEquals(2, index.size());
        assertThat(index.getVector("A")).hasValueSatisfying(v ->
                assertThat(v).containsExactly(new FeatureVectorizer(128, 0x5EED).vectorize("red shoes")));
    }

    @Test
    void rebuildReplacesPreviousContents() {
        index.rebuild(List.of(new ProductText("A", "one"), new ProductText("B", "two")));
        index.rebuild(List.of(new ProductText("C", "three")));

        assertThat(index.contains("A")).isFalse();
        assertThat(index.contains("C")).isTrue();
        assertEquals(1, index.size());
    }

    @Test
    void rebuildingSameCatalogTwiceGivesSameNeighbours() {
        List<ProductText> catalog = List.of(
                new ProductText("P1", "wireless headphones audio bluetooth"),
                new ProductText("P2", "bluetooth speaker audio"),
                new ProductText("P3", "running shoes"),
                new ProductText("P4", "trail running shoes"),
                new ProductText("P5", "wireless headphones"));

        index.rebuild(catalog);
        Map<String, List<SimilarProduct>> first = neighboursOfEveryProduct(catalog);

        index.rebuild(catalog);
        Map<String, List<SimilarProduct>> second = neighboursOfEveryProduct(catalog);

        assertThat(second).isEqualTo(first);
        assertThat(first.get("P3")).first().extracting(SimilarProduct::getProductId).isEqualTo("P4");
    }

    private Map<String, List<SimilarProduct>> neighboursOfEveryProduct(List<ProductText> catalog) {
        Map<String, List<SimilarProduct>> neighbours = new LinkedHashMap<>();
        for (ProductText product : catalog) {
            neighbours.put(product.productId(), index.scoredNeighbors(product.productId(), catalog.size()));
        }
        return neighbours;
    }

    @Test
    void upsertAppendsNewProductAndRefreshesExisting() {
        index.rebuild(List.of(
                new ProductText("A", "same words"),
                new ProductText("B", "same words")));

        index.upsert("C", "same words");
        assertThat(index.nearestNeighbors("A", 5)).containsExactly("B", "C");

        index.upsert("B", "completely unrelated");
        assertThat(index.nearestNeighbors("A", 1)).containsExactly("C");
        assertEquals(3, index.size());
    }

    @Test
    void removeDropsProduct() {
        index.rebuild(List.of(new ProductText("A", "red"), new ProductText("B", "red")));

        index.remove("B");
        index.remove("never-there");

        assertThat(index.contains("B")).isFalse();
        assertThat(index.nearestNeighbors("A", 5)).isEmpty();
    }

    @Test
    void zeroVectorProductScoresZeroAgainstEverything() {
        index.rebuild(List.of(
                new ProductText("EMPTY", ""),
                new ProductText("A", "red shoes"),
                new ProductText("B", "blue hat")));

        assertThat(index.scoredNeighbors("EMPTY", 5))
                .extracting(SimilarProduct::getSimilarityScore)
                .containsOnly(0.0);
        assertThat(index.nearestNeighbors("EMPTY", 5)).containsExactly("A", "B");
    }

    @Test
    void cosineSimilarityOfKnownVectors() {
        assertEquals(0.0, SimilarityIndex.cosineSimilarity(new float[]{1, 0}, new float[]{0, 1}), 1e-9);
        assertEquals(1.0, SimilarityIndex.cosineSimilarity(new float[]{1, 2}, new float[]{2, 4}), 1e-9);
        assertEquals(-1.0, SimilarityIndex.cosineSimilarity(new float[]{1, 1}, new float[]{-1, -1}), 1e-9);
        assertEquals(0.0, SimilarityIndex.cosineSimilarity(new float[]{0, 0}, new float[]{3, 4}), 1e-9);
    }

    @Test
    void cosineOfVectorWithItselfIsOne() {
        float[] handWritten = {3, -1, 2, 0.5f};
        float[] hashed = new FeatureVectorizer(128, 0x5EED).vectorize("wireless headphones audio bluetooth");

        assertEquals(1.0, SimilarityIndex.cosineSimilarity(handWritten, handWritten), 1e-9);
        assertEquals(1.0, SimilarityIndex.cosineSimilarity(hashed, hashed), 1e-9);
    }
}
