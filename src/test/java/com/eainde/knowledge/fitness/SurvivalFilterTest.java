package com.eainde.knowledge.fitness;

import com.eainde.knowledge.graph.ConnectionGraphBuilder;
import com.eainde.knowledge.model.Fact;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.eainde.knowledge.model.FactFixtures.fact;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SurvivalFilterTest {

    private static final ScoringTable DEFAULT_TABLE = ScoringTableLoader.loadDefault();

    /** Two mentions of "algorithm" in a.md, one of "algorithm" and one of "matrix" in b.txt. */
    private static List<Fact> twoDocumentCorpus() {
        Fact a1 = fact().category("coreCS").object("algorithm").origins("a.md").format("markdown").build();
        Fact a2 = fact().category("coreCS").object("algorithm").origins("a.md").format("markdown").build();
        Fact b1 = fact().category("coreCS").object("algorithm").origins("b.txt").format("text").build();
        Fact b2 = fact().category("algebraicFoundations").object("matrix").origins("b.txt").format("text").build();
        return List.of(a1, a2, b1, b2);
    }

    private static SurvivalFilter filter(ScoringTable table, int generations) {
        return new SurvivalFilter(new FitnessScorer(table), new ConnectionGraphBuilder(), generations);
    }

    // =========================================================================
    //  Single generation
    // =========================================================================

    @Nested
    @DisplayName("Single generation")
    class SingleGeneration {

        @Test
        @DisplayName("connected facts survive and the isolated one is discarded under a strict threshold")
        void isolatedFactDiscarded() {
            ScoringTable strict = DEFAULT_TABLE.withSelection(DEFAULT_TABLE.selection().withSurvivalThreshold(0.7));

            SurvivalResult result = filter(strict, 1).apply(twoDocumentCorpus());

            assertThat(result.evaluated()).isEqualTo(4);
            assertThat(result.discarded()).isEqualTo(1);
            assertThat(result.survivors()).hasSize(3)
                    .allSatisfy(f -> {
                        assertThat(f.object()).isEqualTo("algorithm");
                        assertThat(f.neighborCount()).isEqualTo(2);
                        assertThat(f.fitness()).isCloseTo(0.8 * 1.4, within(1e-9));
                        assertThat(f.generation()).isEqualTo(1);
                    });
        }

        @Test
        @DisplayName("every fact survives the default threshold")
        void defaultThreshold() {
            SurvivalResult result = filter(DEFAULT_TABLE, 1).apply(twoDocumentCorpus());

            assertThat(result.survivors()).hasSize(4);
            Fact matrix = result.survivors().get(3);
            assertThat(matrix.neighborCount()).isZero();
            assertThat(matrix.fitness()).isCloseTo(0.8 * 1.2 * 0.7, within(1e-9));
            assertThat(result.survivalRate()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("survivors keep input order and only survivors are returned")
        void survivorsAboveThreshold() {
            ScoringTable strict = DEFAULT_TABLE.withSelection(DEFAULT_TABLE.selection().withSurvivalThreshold(0.7));

            SurvivalResult result = filter(strict, 1).apply(twoDocumentCorpus());

            assertThat(result.survivors()).extracting(Fact::primaryOrigin)
                    .containsExactly("a.md", "a.md", "b.txt");
            assertThat(result.survivors()).allMatch(f -> strict.selection().survives(f.fitness()));
        }

        @Test
        @DisplayName("an empty population yields an empty result")
        void empty() {
            SurvivalResult result = filter(DEFAULT_TABLE, 1).apply(List.of());

            assertThat(result.survivors()).isEmpty();
            assertThat(result.survivalRate()).isZero();
        }
    }

    // =========================================================================
    //  Multiple generations
    // =========================================================================

    @Nested
    @DisplayName("Multiple generations")
    class MultipleGenerations {

        private List<Fact> populationWithWeakLoner() {
            Fact loner = fact().category("misc").object("lonely").confidence(0.5)
                    .origins("x.hs").format("haskell").build();
            List<Fact> corpus = new ArrayList<>(twoDocumentCorpus().subList(0, 3));
            corpus.add(loner);
            return corpus;
        }

        @Test
        @DisplayName("a single generation keeps a weak loner above the threshold")
        void singleGenerationKeepsLoner() {
            SurvivalResult result = filter(DEFAULT_TABLE, 1).apply(populationWithWeakLoner());

            assertThat(result.survivors()).hasSize(4);
            assertThat(result.generations()).isEqualTo(1);
        }

        @Test
        @DisplayName("iteration removes the loner and stops at a fixed point")
        void fixedPoint() {
            SurvivalResult result = filter(DEFAULT_TABLE, 10).apply(populationWithWeakLoner());

            assertThat(result.generations()).isEqualTo(3);
            assertThat(result.discarded()).isEqualTo(1);
            assertThat(result.survivors()).hasSize(3)
                    .allSatisfy(f -> {
                        assertThat(f.object()).isEqualTo("algorithm");
                        assertThat(f.fitness()).isEqualTo(1.5);
                        assertThat(f.generation()).isEqualTo(3);
                    });
        }

        @Test
        @DisplayName("the generation limit caps iteration")
        void generationLimit() {
            SurvivalResult result = filter(DEFAULT_TABLE, 2).apply(populationWithWeakLoner());

            assertThat(result.generations()).isEqualTo(2);
            assertThat(result.survivors()).hasSize(3);
        }

        @Test
        @DisplayName("fewer than one generation is rejected")
        void invalidLimit() {
            assertThatThrownBy(() -> filter(DEFAULT_TABLE, 0))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
