package bigo.conductor.worker;

import bigo.conductor.model.Backend;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CostEstimatorTest {

    @Test
    void fourCharsPerToken() {
        assertEquals(0, CostEstimator.estimateTokens(3));
        assertEquals(250, CostEstimator.estimateTokens(1000));
    }

    @Test
    void claudePricesByVariant() {
        // 4M chars in, 4M chars out -> 1M tokens each
        assertEquals(90.0, CostEstimator.claudeCost(Backend.CLAUDE_OPUS, 4_000_000, 4_000_000), 1e-9);
        assertEquals(18.0, CostEstimator.claudeCost(Backend.CLAUDE_SONNET, 4_000_000, 4_000_000), 1e-9);
        assertEquals(1.5, CostEstimator.claudeCost(Backend.CLAUDE_HAIKU, 4_000_000, 4_000_000), 1e-9);
    }

    @Test
    void geminiBlendedRate() {
        assertEquals(7.0, CostEstimator.geminiCost(Backend.GEMINI_PRO, 1_000_000), 1e-9);
        assertEquals(0.5, CostEstimator.geminiCost(Backend.GEMINI_FLASH, 1_000_000), 1e-9);
    }
}
