package com.napipe.plan;

import com.napipe.exception.ConfigurationException;
import com.napipe.exception.ConfigurationException.Reason;
import com.napipe.runtime.InMemoryStages;
import com.napipe.schema.Field;
import com.napipe.schema.Schema;
import com.napipe.stage.StageException;
import com.napipe.stage.StageKind;
import com.napipe.stage.StrategyKind;
import com.napipe.test.Schemas;
import com.napipe.test.TestBase;
import com.napipe.test.TestCategories;
import com.napipe.types.DoubleType;
import com.napipe.types.FloatType;
import com.napipe.types.VectorType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for composing whole request lists into pipelines.
 *
 * <p>Covers the stage layout for each combination of settings, the output schema
 * contract, request-level validation, and error reporting modes.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("PipelineComposer Tests")
public class PipelineComposerTest extends TestBase {

    private final PipelineDefaults defaults = PipelineDefaults.standard();

    private PipelineComposer composer;

    @Override
    protected void doSetUp() {
        composer = new PipelineComposer(InMemoryStages.collaborators(), false);
    }

    @Nested
    @DisplayName("Stage layout")
    class StageLayout {

        @Test
        @DisplayName("TC-COMP-001: Without indicator only a replacer is needed")
        void testReplacerOnly() {
            logStep("Given: age requested with mean and no indicator");
            List<ColumnRequest> requests = List.of(
                ColumnRequest.of("age").withStrategy(StrategyKind.MEAN).withEmitIndicator(false));

            logStep("When: composing");
            ComposedPipeline pipeline = composer.compose(requests, defaults, Schemas.age());

            logStep("Then: one replacer stage, output is age");
            assertThat(pipeline.stageKinds()).containsExactly(StageKind.REPLACER);
            assertThat(pipeline.outputSchema().columnNames()).containsExactly("age");
            assertThat(pipeline.outputSchema().field(0).dataType()).isEqualTo(DoubleType.get());
        }

        @Test
        @DisplayName("TC-COMP-002: A numeric column with indicator uses all five stages")
        void testAllStages() {
            ComposedPipeline pipeline = composer.compose(List.of(ColumnRequest.of("age")), defaults, Schemas.age());
            logData("Pipeline", pipeline.explain());

            assertThat(pipeline.stageKinds()).containsExactly(
                StageKind.INDICATOR, StageKind.COERCER, StageKind.REPLACER, StageKind.MERGER, StageKind.DROPPER);
            Field output = pipeline.outputSchema().field(0);
            assertThat(output.name()).isEqualTo("age");
            assertThat(output.dataType()).isEqualTo(new VectorType(DoubleType.get(), 2));
            assertThat(output.slotNames()).containsExactly("age", "IsMissing.age");
        }

        @Test
        @DisplayName("TC-COMP-003: A boolean column with indicator skips the coercer")
        void testBooleanSkipsCoercer() {
            ComposedPipeline pipeline = composer.compose(List.of(ColumnRequest.of("flag")), defaults, Schemas.mixed());

            assertThat(pipeline.stageKinds()).containsExactly(
                StageKind.INDICATOR, StageKind.REPLACER, StageKind.MERGER, StageKind.DROPPER);
        }

        @Test
        @DisplayName("TC-COMP-004: Variable-length vectors stay variable-length after merging")
        void testVariableLengthMerge() {
            ComposedPipeline pipeline = composer.compose(List.of(ColumnRequest.of("tokens")), defaults, Schemas.mixed());

            assertThat(pipeline.outputSchema().field(0).dataType()).isEqualTo(new VectorType(FloatType.get()));
            assertThat(pipeline.outputSchema().field(0).slotNames()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Output schema")
    class OutputSchema {

        @Test
        @DisplayName("TC-COMP-010: Output holds exactly the requested names in request order")
        void testOutputOrder() {
            List<ColumnRequest> requests = List.of(
                ColumnRequest.of("name").withEmitIndicator(false),
                ColumnRequest.of("feat"),
                ColumnRequest.of("age_mean", "age").withStrategy(StrategyKind.MEAN).withEmitIndicator(false),
                ColumnRequest.of("age"));

            ComposedPipeline pipeline = composer.compose(requests, defaults, Schemas.mixed());

            assertThat(pipeline.outputSchema().columnNames()).containsExactly("name", "feat", "age_mean", "age");
            assertThat(pipeline.outputSchema().columnNames()).noneMatch(name -> name.startsWith("temp_"));
        }

        @Test
        @DisplayName("TC-COMP-011: Temporary names avoid input columns and requested outputs")
        void testTempNamesAvoidCollisions() {
            Schema schema = new Schema(
                new Field("age", DoubleType.get()),
                new Field("temp_IsMissing_000", DoubleType.get()));
            List<ColumnRequest> requests = List.of(
                ColumnRequest.of("age"),
                ColumnRequest.of("temp_Replace_000", "age").withEmitIndicator(false));

            ComposedPipeline pipeline = composer.compose(requests, defaults, schema);

            assertThat(List.<Object>copyOf(pipeline.stage(StageKind.DROPPER).instructions()))
                .containsExactly("temp_IsMissing_001", "temp_Replace_001");
            assertThat(pipeline.outputSchema().columnNames()).containsExactly("age", "temp_Replace_000");
        }

        @Test
        @DisplayName("TC-COMP-012: Composing twice yields equal pipelines")
        void testDeterministic() {
            List<ColumnRequest> requests = List.of(ColumnRequest.of("age"), ColumnRequest.of("feat"));

            ComposedPipeline first = composer.compose(requests, defaults, Schemas.mixed());
            ComposedPipeline second = composer.compose(requests, defaults, Schemas.mixed());

            assertThat(first).isEqualTo(second);
            assertThat(first.hashCode()).isEqualTo(second.hashCode());
            assertThat(first.outputSchema()).isEqualTo(second.outputSchema());
            assertThat(first.stages()).isEqualTo(second.stages());
            assertThat(first.inputSchema()).isEqualTo(Schemas.mixed());
            assertThat(first.explain()).contains("Indicator", "temp_IsMissing_000 <- isMissing(age)");
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("TC-COMP-020: Duplicate output names are rejected")
        void testDuplicateOutput() {
            List<ColumnRequest> requests = List.of(ColumnRequest.of("x", "age"), ColumnRequest.of("x", "count"));

            assertThatThrownBy(() -> composer.compose(requests, defaults, Schemas.mixed()))
                .isInstanceOf(ConfigurationException.class)
                .extracting(e -> ((ConfigurationException) e).getReason())
                .isEqualTo(Reason.DUPLICATE_OUTPUT_NAME);
        }

        @Test
        @DisplayName("TC-COMP-024: Duplicate outputs are rejected before any source is looked up")
        void testDuplicateOutputBeforePlanning() {
            List<ColumnRequest> requests = List.of(ColumnRequest.of("x", "nope"), ColumnRequest.of("x", "age"));

            ConfigurationException error = catchThrowableOfType(
                () -> composer.compose(requests, defaults, Schemas.mixed()),
                ConfigurationException.class);

            assertThat(error.getReason()).isEqualTo(Reason.DUPLICATE_OUTPUT_NAME);
            assertThat(error.getColumnName()).isEqualTo("x");
        }

        @Test
        @DisplayName("TC-COMP-021: Empty request lists are rejected")
        void testEmptyRequest() {
            assertThatThrownBy(() -> composer.compose(List.of(), defaults, Schemas.mixed()))
                .isInstanceOf(ConfigurationException.class)
                .extracting(e -> ((ConfigurationException) e).getReason())
                .isEqualTo(Reason.EMPTY_REQUEST);
        }

        @Test
        @DisplayName("TC-COMP-022: Mean over text is rejected by the replacer")
        void testMeanOverText() {
            List<ColumnRequest> requests = List.of(
                ColumnRequest.of("name").withStrategy(StrategyKind.MEAN).withEmitIndicator(false));

            assertThatThrownBy(() -> composer.compose(requests, defaults, Schemas.mixed()))
                .isInstanceOf(StageException.class)
                .extracting(e -> ((StageException) e).getStageKind())
                .isEqualTo(StageKind.REPLACER);
        }

        @Test
        @DisplayName("TC-COMP-023: User messages carry a hint")
        void testUserMessage() {
            ConfigurationException error = catchThrowableOfType(
                () -> composer.compose(List.of(ColumnRequest.of("wait")), defaults, Schemas.mixed()),
                ConfigurationException.class);

            assertThat(error.getUserMessage())
                .startsWith(error.getMessage())
                .contains("Disable the indicator");
        }
    }

    @Nested
    @DisplayName("Error reporting")
    class ErrorReporting {

        private final List<ColumnRequest> badRequests = List.of(
            ColumnRequest.of("wait"),
            ColumnRequest.of("age"),
            ColumnRequest.of("tokens").withImputeBySlot(true),
            ColumnRequest.of("out", "nope"));

        @Test
        @DisplayName("TC-COMP-030: The first error aborts by default")
        void testFailFast() {
            ConfigurationException error = catchThrowableOfType(
                () -> composer.compose(badRequests, defaults, Schemas.mixed()), ConfigurationException.class);

            assertThat(error.getReason()).isEqualTo(Reason.INCOMPATIBLE_INDICATOR_TYPE);
            assertThat(error.getSuppressed()).isEmpty();
        }

        @Test
        @DisplayName("TC-COMP-031: All errors are reported when enabled")
        void testReportAll() {
            PipelineComposer reporting = new PipelineComposer(InMemoryStages.collaborators(), true);

            ConfigurationException error = catchThrowableOfType(
                () -> reporting.compose(badRequests, defaults, Schemas.mixed()), ConfigurationException.class);

            assertThat(error.getReason()).isEqualTo(Reason.INCOMPATIBLE_INDICATOR_TYPE);
            assertThat(error.getSuppressed())
                .extracting(e -> ((ConfigurationException) e).getReason())
                .containsExactly(Reason.INVALID_SLOT_IMPUTATION, Reason.UNKNOWN_SOURCE_COLUMN);
        }

        @Test
        @DisplayName("TC-COMP-032: The default composer reads the reporting mode from a system property")
        void testReportAllProperty() {
            System.setProperty(PipelineComposer.PROP_REPORT_ALL_ERRORS, "true");
            try {
                assertThat(new PipelineComposer().isReportAllErrors()).isTrue();
            } finally {
                System.clearProperty(PipelineComposer.PROP_REPORT_ALL_ERRORS);
            }
            assertThat(new PipelineComposer().isReportAllErrors()).isFalse();
        }
    }
}
