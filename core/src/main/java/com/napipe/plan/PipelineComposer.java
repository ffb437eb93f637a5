package com.napipe.plan;

import com.napipe.data.DatasetView;
import com.napipe.exception.ConfigurationException;
import com.napipe.exception.ConfigurationException.Reason;
import com.napipe.runtime.InMemoryStages;
import com.napipe.schema.SchemaView;
import com.napipe.stage.StageCollaborators;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Entry point: composes imputation requests into one {@link ComposedPipeline}.
 *
 * <p>Composition is synchronous and deterministic. The request list is validated
 * as a whole first (non-empty, distinct output names), then each request is
 * planned independently with a temporary-name allocator private to this call, and
 * finally all plans are assembled.
 *
 * <p>Error reporting:
 * <ul>
 *   <li>By default the first failing request aborts composition.</li>
 *   <li>With {@code reportAllErrors} every request is planned; the first error is
 *       thrown with the others attached as suppressed exceptions.</li>
 * </ul>
 *
 * <p>Example:
 * <pre>
 *   PipelineComposer composer = new PipelineComposer();
 *   ComposedPipeline pipeline = composer.compose(
 *       List.of(ColumnRequest.of("age").withStrategy(StrategyKind.MEAN)),
 *       PipelineDefaults.standard(),
 *       dataset);
 *   DatasetView filled = pipeline.apply(dataset);
 * </pre>
 */
public class PipelineComposer {

    private static final Logger logger = LoggerFactory.getLogger(PipelineComposer.class);

    /** System property enabling aggregated error reporting */
    static final String PROP_REPORT_ALL_ERRORS = "napipe.reportAllErrors";

    private final PipelineAssembler assembler;
    private final boolean reportAllErrors;

    /**
     * Creates a composer using the in-memory collaborators and the configured
     * error-reporting mode.
     */
    public PipelineComposer() {
        this(InMemoryStages.collaborators(), PipelineDefaults.configuredFlag(PROP_REPORT_ALL_ERRORS, false));
    }

    /**
     * Creates a composer.
     *
     * @param collaborators the stage collaborators to instantiate
     * @param reportAllErrors whether to plan every request before failing
     */
    public PipelineComposer(StageCollaborators collaborators, boolean reportAllErrors) {
        this.assembler = new PipelineAssembler(collaborators);
        this.reportAllErrors = reportAllErrors;
    }

    public boolean isReportAllErrors() {
        return reportAllErrors;
    }

    /**
     * Composes a pipeline for the given dataset.
     *
     * @param requests the requested columns, in output order
     * @param defaults fallbacks for unset request settings
     * @param input the input dataset
     * @return the composed pipeline
     * @throws ConfigurationException if the requests are invalid for the input
     */
    public ComposedPipeline compose(List<ColumnRequest> requests, PipelineDefaults defaults, DatasetView input) {
        Objects.requireNonNull(input, "input must not be null");
        return compose(requests, defaults, input.schema());
    }

    /**
     * Composes a pipeline for the given input schema.
     *
     * @param requests the requested columns, in output order
     * @param defaults fallbacks for unset request settings
     * @param inputSchema the input schema
     * @return the composed pipeline
     * @throws ConfigurationException if the requests are invalid for the input
     */
    public ComposedPipeline compose(List<ColumnRequest> requests, PipelineDefaults defaults, SchemaView inputSchema) {
        Objects.requireNonNull(defaults, "defaults must not be null");
        Objects.requireNonNull(inputSchema, "inputSchema must not be null");
        if (requests == null || requests.isEmpty()) {
            throw new ConfigurationException(Reason.EMPTY_REQUEST, null, "At least one column must be requested");
        }

        List<String> outputNames = checkDistinctOutputs(requests);
        ColumnPlanner planner = new ColumnPlanner(new SequentialTempNameAllocator(outputNames));

        List<ColumnPlan> plans = new ArrayList<>(requests.size());
        ConfigurationException firstError = null;
        for (ColumnRequest request : requests) {
            try {
                plans.add(planner.plan(request, defaults, inputSchema));
            } catch (ConfigurationException e) {
                if (!reportAllErrors) {
                    throw e;
                }
                if (firstError == null) {
                    firstError = e;
                } else {
                    firstError.addSuppressed(e);
                }
            }
        }
        if (firstError != null) {
            logger.debug("Composition failed for {} of {} column(s)",
                firstError.getSuppressed().length + 1, requests.size());
            throw firstError;
        }

        ComposedPipeline pipeline = assembler.assemble(plans, inputSchema);
        logger.info("Composed pipeline {} for {} column(s)", pipeline.stageKinds(), requests.size());
        return pipeline;
    }

    private static List<String> checkDistinctOutputs(List<ColumnRequest> requests) {
        Set<String> seen = new HashSet<>();
        List<String> outputNames = new ArrayList<>(requests.size());
        for (ColumnRequest request : requests) {
            Objects.requireNonNull(request, "requests must not contain null");
            if (!seen.add(request.outputName())) {
                throw new ConfigurationException(Reason.DUPLICATE_OUTPUT_NAME, request.outputName(),
                    "Output column '" + request.outputName() + "' is requested more than once");
            }
            outputNames.add(request.outputName());
        }
        return outputNames;
    }
}
