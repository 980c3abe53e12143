package uk.gegc.aimeter.features.ai.application;

import uk.gegc.aimeter.features.ai.domain.model.GraphDescriptor;
import uk.gegc.aimeter.features.ai.domain.model.GraphRunRequest;
import uk.gegc.aimeter.features.ai.domain.model.GraphRunResult;

import java.util.List;

public interface GraphExecutor {

    List<GraphDescriptor> listGraphs();

    /**
     * Never throws: failures are reported through the returned stream and final result.
     */
    GraphRunResult runGraph(GraphRunRequest request);
}
