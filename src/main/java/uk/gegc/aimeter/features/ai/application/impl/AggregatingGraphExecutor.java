package uk.gegc.aimeter.features.ai.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.aimeter.features.ai.application.GraphExecutor;
import uk.gegc.aimeter.features.ai.application.GraphProvider;
import uk.gegc.aimeter.features.ai.domain.model.GraphDescriptor;
import uk.gegc.aimeter.features.ai.domain.model.GraphErrorCode;
import uk.gegc.aimeter.features.ai.domain.model.GraphId;
import uk.gegc.aimeter.features.ai.domain.model.GraphRunRequest;
import uk.gegc.aimeter.features.ai.domain.model.GraphRunResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Routes runs to the provider named by the graph id prefix and aggregates graph discovery.
 */
@Slf4j
@Service
public class AggregatingGraphExecutor implements GraphExecutor {

    private final Map<String, GraphProvider> providers;

    public AggregatingGraphExecutor(List<GraphProvider> providers) {
        Map<String, GraphProvider> byId = new LinkedHashMap<>();
        for (GraphProvider provider : providers) {
            GraphProvider previous = byId.putIfAbsent(provider.providerId(), provider);
            if (previous != null) {
                throw new IllegalStateException("Duplicate graph provider id '" + provider.providerId() + "': "
                        + previous.getClass().getSimpleName() + " and " + provider.getClass().getSimpleName());
            }
        }
        this.providers = Collections.unmodifiableMap(byId);
        log.info("Graph providers registered: {}", this.providers.keySet());
    }

    @Override
    public List<GraphDescriptor> listGraphs() {
        return providers.values().stream()
                .flatMap(provider -> provider.listGraphs().stream())
                .toList();
    }

    @Override
    public GraphRunResult runGraph(GraphRunRequest request) {
        GraphProvider provider = GraphId.parse(request.graphName())
                .map(GraphId::providerId)
                .map(providers::get)
                .orElse(null);

        if (provider == null) {
            log.error("No provider found for graph {} runId={}", request.graphName(), request.runId());
            return GraphRunResult.failed(request.runId(), request.ingressRequestId(),
                    "No provider found for graph: " + request.graphName(), GraphErrorCode.INTERNAL);
        }

        try {
            return provider.runGraph(request);
        } catch (RuntimeException e) {
            log.error("Provider {} failed to start graph {} runId={}",
                    provider.providerId(), request.graphName(), request.runId(), e);
            return GraphRunResult.failed(request.runId(), request.ingressRequestId(),
                    "Failed to start graph: " + request.graphName(), GraphErrorCode.INTERNAL);
        }
    }
}
