package bigo.conductor.worker;

import bigo.conductor.model.Backend;

/**
 * Rough token and cost figures for backends that do not report them.
 * Prices are USD per million tokens.
 */
public final class CostEstimator {

    static final int CHARS_PER_TOKEN = 4;

    private CostEstimator() {
    }

    public static int estimateTokens(int charCount) {
        return charCount / CHARS_PER_TOKEN;
    }

    /**
     * Claude pricing split by input and output; unknown variants are priced as sonnet.
     */
    public static double claudeCost(Backend backend, int inputChars, int outputChars) {
        double inputPrice;
        double outputPrice;
        switch (backend) {
            case CLAUDE_OPUS -> {
                inputPrice = 15.0;
                outputPrice = 75.0;
            }
            case CLAUDE_HAIKU -> {
                inputPrice = 0.25;
                outputPrice = 1.25;
            }
            default -> {
                inputPrice = 3.0;
                outputPrice = 15.0;
            }
        }
        double inputTokens = (double) inputChars / CHARS_PER_TOKEN;
        double outputTokens = (double) outputChars / CHARS_PER_TOKEN;
        return (inputTokens * inputPrice + outputTokens * outputPrice) / 1_000_000;
    }

    /** Blended Gemini rate: flash 0.5, pro 7.0. */
    public static double geminiCost(Backend backend, int tokens) {
        double ratePerMillion = backend == Backend.GEMINI_PRO ? 7.0 : 0.5;
        return tokens * ratePerMillion / 1_000_000;
    }
}
