package com.extractionplatform.common.certainty;

import com.extractionplatform.common.config.SynthesisConfig;
import com.extractionplatform.common.model.CertaintyClass;
import com.extractionplatform.common.model.Evidence;
import com.extractionplatform.common.model.FindingType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static com.extractionplatform.common.Fixtures.ev;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link CertaintyClassifier} against the default tables
 * (language maxPossible = 3.0, framework = 4.0, generic = 2.0).
 */
class CertaintyClassifierTest {

    private final CertaintyClassifier classifier = new CertaintyClassifier(SynthesisConfig.defaults());

    @Nested
    @DisplayName("bands")
    class Bands {

        @Test
        @DisplayName("no evidence → UNKNOWN, score 0")
        void empty_unknown() {
            CertaintyAssessment a = classifier.classify(FindingType.LANGUAGE, List.of());
            assertEquals(CertaintyClass.UNKNOWN, a.certaintyClass());
            assertEquals(0.0, a.score());
        }

        @Test
        @DisplayName("2.7 / 3.0 = 0.90 → INFERRED")
        void inferredBand() {
            CertaintyAssessment a = classifier.classify(FindingType.LANGUAGE, List.of(
                ev("config_file", 1.0, "package.json"),
                ev("file_ext", 0.8, "src/index.ts"),
                ev("dependency", 0.9, "package.json#typescript")));
            assertEquals(CertaintyClass.INFERRED, a.certaintyClass());
            assertEquals(0.9, a.score(), 1e-9);
        }

        @Test
        @DisplayName("mass above maxPossible is capped → CERTAIN at 1.0")
        void capped_certain() {
            CertaintyAssessment a = classifier.classify(FindingType.LANGUAGE, List.of(
                ev("config_file", 1.0, "package.json"),
                ev("file_ext", 0.8, "src/index.ts"),
                ev("dependency", 0.9, "package.json#typescript"),
                ev("doc", 0.6, "README.md#L3")));
            assertEquals(CertaintyClass.CERTAIN, a.certaintyClass());
            assertEquals(1.0, a.score());
            assertEquals(3.0, a.rawWeight());
        }

        @Test
        @DisplayName("exactly on the 0.95 boundary → CERTAIN")
        void boundary_certain() {
            CertaintyAssessment a = classifier.classify(FindingType.GENERIC, List.of(
                ev("config_file", 1.0, "a"),
                ev("doc", 0.9, "b")));
            assertEquals(CertaintyClass.CERTAIN, a.certaintyClass());
        }

        @Test
        @DisplayName("band lookup edges")
        void bandEdges() {
            assertEquals(CertaintyClass.INFERRED,   CertaintyClass.forScore(0.94));
            assertEquals(CertaintyClass.INFERRED,   CertaintyClass.forScore(0.80));
            assertEquals(CertaintyClass.SPECULATED, CertaintyClass.forScore(0.79));
            assertEquals(CertaintyClass.SPECULATED, CertaintyClass.forScore(0.60));
            assertEquals(CertaintyClass.UNKNOWN,    CertaintyClass.forScore(0.59));
        }

        @Test
        @DisplayName("framework findings need more mass than language findings")
        void framework_largerMaxPossible() {
            List<Evidence> evidence = List.of(ev("config_file", 1.0, "pom.xml"), ev("code_pattern", 0.7, "App.java"));
            assertTrue(classifier.classify(FindingType.FRAMEWORK, evidence).score()
                     < classifier.classify(FindingType.LANGUAGE, evidence).score());
        }
    }

    @Nested
    @DisplayName("determinism")
    class Determinism {

        @Test
        @DisplayName("every permutation of the same evidence classifies identically")
        void permutations_identical() {
            List<Evidence> evidence = new ArrayList<>(List.of(
                ev("config_file", 1.0, "pom.xml"),
                ev("file_ext", 0.8, "src/A.java"),
                ev("naming", 0.3, "src/OrderService.java"),
                ev("doc", 0.6, "README.md#L2"),
                ev("code_pattern", 0.7, "src/App.java")));
            CertaintyAssessment expected = classifier.classify(FindingType.LANGUAGE, evidence);

            Random random = new Random(42);
            for (int i = 0; i < 50; i++) {
                Collections.shuffle(evidence, random);
                assertEquals(expected, classifier.classify(FindingType.LANGUAGE, evidence));
            }
        }

        @Test
        @DisplayName("duplicates do not change the outcome")
        void duplicates_ignored() {
            List<Evidence> base = List.of(ev("doc", 0.6, "README.md#L1"), ev("file_ext", 0.8, "a.py"));
            List<Evidence> withDupes = List.of(
                ev("doc", 0.6, "README.md#L1"), ev("file_ext", 0.8, "a.py"),
                ev("doc", 0.6, "README.md#L1", "other snippet"));
            assertEquals(classifier.classify(FindingType.LANGUAGE, base),
                         classifier.classify(FindingType.LANGUAGE, withDupes));
        }
    }

    @Nested
    @DisplayName("monotonicity")
    class Monotonicity {

        @Test
        @DisplayName("adding non-duplicate evidence never decreases the score")
        void addingEvidence_neverDecreases() {
            List<Evidence> evidence = new ArrayList<>();
            double previous = 0.0;
            String[] kinds = {"default_assumption", "naming", "directory_layout", "doc", "code_pattern",
                              "file_ext", "dependency", "config_file"};
            double[] weights = {0.1, 0.3, 0.5, 0.6, 0.7, 0.8, 0.9, 1.0};
            for (int i = 0; i < kinds.length; i++) {
                evidence.add(ev(kinds[i], weights[i], "loc-" + i));
                double score = classifier.classify(FindingType.FRAMEWORK, evidence).score();
                assertTrue(score >= previous, "score dropped after adding " + kinds[i]);
                previous = score;
            }
        }

        @Test
        @DisplayName("a heavier duplicate of an existing item never decreases the score")
        void heavierDuplicate_neverDecreases() {
            List<Evidence> evidence = new ArrayList<>(List.of(ev("doc", 0.3, "README.md#L1")));
            double before = classifier.classify(FindingType.GENERIC, evidence).score();
            evidence.add(ev("doc", 0.6, "README.md#L1"));
            assertTrue(classifier.classify(FindingType.GENERIC, evidence).score() >= before);
        }
    }
}
