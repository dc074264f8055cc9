package bigo.conductor.api.v1;

import bigo.conductor.api.Controller;
import bigo.conductor.api.v1.dto.ClassificationResponse;
import bigo.conductor.api.v1.dto.TaskRequest;
import bigo.conductor.classifier.Classifier;
import bigo.conductor.model.ClassificationResult;
import bigo.conductor.policy.TierPolicy;
import bigo.conductor.server.RouterHandler;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;

/**
 * POST /api/v1/classify - tier, confidence and routing for a task text. Records nothing.
 */
public class ClassifyController implements Controller {

    private final Classifier classifier;
    private final TierPolicy policy;

    public ClassifyController(Classifier classifier, TierPolicy policy) {
        this.classifier = classifier;
        this.policy = policy;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && "/api/v1/classify".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            TaskRequest request = TaskController.readRequest(req);
            ClassificationResult result = classifier.classify(request.title(), request.descriptionOrEmpty());
            if (request.forcedTier() != null) {
                result = classifier.forceTier(result, request.forcedTier());
            }
            ClassificationResponse response = ClassificationResponse.from(
                    result, policy.config(result.tier()), policy.fallbacks(result.tier()));
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("invalid request body: " + e.getOriginalMessage());
        }
    }
}
