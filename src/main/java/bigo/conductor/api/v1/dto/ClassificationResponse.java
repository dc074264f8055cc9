package bigo.conductor.api.v1.dto;

import bigo.conductor.model.Backend;
import bigo.conductor.model.ClassificationResult;
import bigo.conductor.model.TierConfig;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response DTO for a classification with its routing.
 * POST /api/v1/classify
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClassificationResponse(
        @JsonProperty("tier") String tier,
        @JsonProperty("tierLevel") int tierLevel,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("recommendedBackend") String recommendedBackend,
        @JsonProperty("patterns") List<String> patterns,
        @JsonProperty("estimatedLines") int estimatedLines,
        @JsonProperty("estimatedFiles") int estimatedFiles,
        @JsonProperty("reasoning") String reasoning,
        @JsonProperty("validatorCount") Integer validatorCount,
        @JsonProperty("requiredApprovals") Integer requiredApprovals,
        @JsonProperty("fallbacks") List<String> fallbacks) {

    public static ClassificationResponse from(ClassificationResult c) {
        return new ClassificationResponse(
                c.tier().label(),
                c.tier().level(),
                c.confidence(),
                c.recommendedBackend().id(),
                c.patterns(),
                c.estimatedLines(),
                c.estimatedFiles(),
                c.reasoning(),
                null,
                null,
                null);
    }

    public static ClassificationResponse from(ClassificationResult c, TierConfig config, List<Backend> fallbacks) {
        return new ClassificationResponse(
                c.tier().label(),
                c.tier().level(),
                c.confidence(),
                c.recommendedBackend().id(),
                c.patterns(),
                c.estimatedLines(),
                c.estimatedFiles(),
                c.reasoning(),
                config.validatorCount(),
                config.requiredApprovals(),
                fallbacks.stream().map(Backend::id).toList());
    }
}
