package bigo.conductor.classifier;

import bigo.conductor.model.Backend;
import bigo.conductor.model.ClassificationResult;
import bigo.conductor.model.Tier;
import bigo.conductor.policy.TierPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ClassifierTest {

    private final Classifier classifier = new Classifier(TierPolicy.defaults());

    @Test
    @DisplayName("Typo fix is trivial and stays local")
    void typoIsTrivial() {
        ClassificationResult r = classifier.classify("fix the typo in the word recieve", "");

        assertEquals(Tier.TRIVIAL, r.tier());
        assertEquals(Backend.OLLAMA_FAST, r.recommendedBackend());
        assertEquals(0.635, r.confidence(), 1e-9);
        assertEquals(List.of("typo"), r.patterns());
        assertEquals(50, r.estimatedLines());
        assertEquals(2, r.estimatedFiles());
    }

    @Test
    @DisplayName("Security and payments text is critical")
    void securityPaymentsIsCritical() {
        ClassificationResult r = classifier.classify("implement authentication for the payment API", null);

        assertEquals(Tier.CRITICAL, r.tier());
        assertEquals(Backend.CLAUDE_OPUS, r.recommendedBackend());
        assertEquals(List.of("security", "payments"), r.patterns());
        assertEquals(0.77, r.confidence(), 1e-9);
    }

    @Test
    void refactorAcrossFilesIsStandard() {
        ClassificationResult r = classifier.classify(
                "refactor the widget to use new component pattern, across multiple files", "");

        assertEquals(Tier.STANDARD, r.tier());
        assertEquals(Backend.CLAUDE_SONNET, r.recommendedBackend());
        assertEquals(List.of("refactor"), r.patterns());
        assertEquals(0.59, r.confidence(), 1e-9);
        assertEquals(10, r.estimatedFiles());
        assertEquals(50, r.estimatedLines());
    }

    @Test
    void codebaseWideScopeEscalatesToComplex() {
        ClassificationResult r = classifier.classify("apply the change across the entire codebase", "");

        assertEquals(Tier.COMPLEX, r.tier());
        assertTrue(r.patterns().isEmpty());
        assertEquals(0.5, r.confidence(), 1e-9);
        assertEquals(20, r.estimatedFiles());
        assertEquals(500, r.estimatedLines());
    }

    @Test
    void smallSingleFileWorkDeescalatesToSimple() {
        ClassificationResult r = classifier.classify("refactor the parser helper in this file", "");

        assertEquals(Tier.SIMPLE, r.tier());
        assertEquals(Backend.OLLAMA_DEFAULT, r.recommendedBackend());
        assertEquals(5, r.estimatedLines());
        assertEquals(1, r.estimatedFiles());
    }

    @Test
    void noMatchDefaultsToStandard() {
        ClassificationResult r = classifier.classify("do the thing", "");

        assertEquals(Tier.STANDARD, r.tier());
        assertEquals(0.5, r.confidence(), 1e-9);
        assertTrue(r.patterns().isEmpty());
    }

    @Test
    void descriptionIsPartOfTheText() {
        ClassificationResult r = classifier.classify("update checkout", "handles customer data and billing");
        assertEquals(Tier.CRITICAL, r.tier());
    }

    @Test
    void classificationIsDeterministic() {
        String title = "Add a new field to the user profile";
        assertEquals(classifier.classify(title, "x"), classifier.classify(title, "x"));
    }

    @Test
    void reasoningNamesTierPatternsAndScope() {
        ClassificationResult r = classifier.classify("fix the typo in the word recieve", "");
        assertEquals("Tier: TRIVIAL. Matched patterns: typo. Estimated scope: ~50 lines across 2 file(s)",
                r.reasoning());
    }

    @Test
    void tieGoesToTheLowerTier() {
        Map<Tier, List<WeightedPattern>> rules = new EnumMap<>(Tier.class);
        rules.put(Tier.SIMPLE, List.of(WeightedPattern.of("alpha", "alpha", 0.7)));
        rules.put(Tier.COMPLEX, List.of(WeightedPattern.of("beta", "beta", 0.7)));
        Classifier tied = new Classifier(ClassifierRules.of(rules), TierPolicy.defaults());

        ClassificationResult r = tied.classify("alpha beta", "");

        assertEquals(Tier.SIMPLE, r.tier());
        assertEquals(List.of("alpha"), r.patterns());
    }

    @Test
    void confidenceIsCapped() {
        ClassificationResult r = classifier.classify(
                "security fix for payment encryption of production data and customer data in the core logic", "");
        assertEquals(Tier.CRITICAL, r.tier());
        assertEquals(0.95, r.confidence(), 1e-9);
    }

    @Test
    void forceTierRoutesToForcedPrimary() {
        ClassificationResult r = classifier.forceTier(classifier.classify("do the thing", ""), Tier.CRITICAL);

        assertEquals(Tier.CRITICAL, r.tier());
        assertEquals(Backend.CLAUDE_OPUS, r.recommendedBackend());
        assertTrue(r.reasoning().startsWith("Tier forced to CRITICAL"));
    }

    @Test
    void scopeAdjustment() {
        assertEquals(Tier.COMPLEX, Classifier.adjustByScope(Tier.TRIVIAL, 50, 11));
        assertEquals(Tier.STANDARD, Classifier.adjustByScope(Tier.TRIVIAL, 201, 2));
        assertEquals(Tier.SIMPLE, Classifier.adjustByScope(Tier.CRITICAL, 5, 1));
        assertEquals(Tier.TRIVIAL, Classifier.adjustByScope(Tier.TRIVIAL, 5, 1));
        assertEquals(Tier.CRITICAL, Classifier.adjustByScope(Tier.CRITICAL, 1000, 20));
    }
}
