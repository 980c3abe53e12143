package uk.gegc.aimeter.features.ai.application;

import uk.gegc.aimeter.features.ai.domain.model.GraphDescriptor;
import uk.gegc.aimeter.features.ai.domain.model.GraphRunRequest;
import uk.gegc.aimeter.features.ai.domain.model.GraphRunResult;

import java.util.List;

/**
 * A source of runnable graphs, registered with the router under {@link #providerId()}.
 */
public interface GraphProvider {

    /**
     * Namespace prefix of every graph this provider owns.
     */
    String providerId();

    List<GraphDescriptor> listGraphs();

    /**
     * Starts a run. The returned stream is lazy; the provider must honour the request's abort signal.
     */
    GraphRunResult runGraph(GraphRunRequest request);
}
