package com.napipe.integration;

import com.napipe.data.DatasetView;
import com.napipe.data.InMemoryDataset;
import com.napipe.parser.ColumnRequestParser;
import com.napipe.plan.ComposedPipeline;
import com.napipe.plan.PipelineComposer;
import com.napipe.plan.PipelineDefaults;
import com.napipe.schema.SchemaParser;
import com.napipe.test.Schemas;
import com.napipe.test.TestBase;
import com.napipe.test.TestCategories;
import com.napipe.types.DoubleType;
import com.napipe.types.VectorType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end tests: parse requests, compose a pipeline and run it over in-memory data.
 */
@TestCategories.Tier2
@TestCategories.Integration
@DisplayName("End-to-end imputation Tests")
public class EndToEndImputationTest extends TestBase {

    private InMemoryDataset dataset;
    private PipelineComposer composer;

    @Override
    protected void doSetUp() {
        dataset = InMemoryDataset.builder(Schemas.mixed())
            .addRow(30.0, 2, "x", true, Duration.ofSeconds(10),
                Arrays.asList(1f, null, 3f), Arrays.asList(1f))
            .addRow(null, null, null, null, null,
                Arrays.asList(Float.NaN, 2f, 5f), Arrays.asList(null, 4f))
            .addRow(50.0, 4, "z", false, Duration.ofSeconds(30),
                Arrays.asList(3f, 6f, null), List.of())
            .build();
        composer = new PipelineComposer();
    }

    @Test
    @DisplayName("TC-E2E-001: Every column shape is filled and merged with its indicator")
    void testMixedColumns() {
        logStep("Given: requests over every column shape");
        List<String> definitions = List.of(
            "age,kind=mean",
            "count,ind=false",
            "flag",
            "wait,kind=mean,ind=false",
            "feat,kind=mean",
            "tokens",
            "name_filled:name,ind=-");

        logStep("When: composing and applying");
        ComposedPipeline pipeline = composer.compose(
            ColumnRequestParser.parseAll(definitions), PipelineDefaults.standard(), dataset);
        logData("Pipeline", pipeline.explain());
        DatasetView result = pipeline.apply(dataset);

        logStep("Then: the output holds the requested columns with absent values filled");
        assertThat(result.schema().columnNames())
            .containsExactly("age", "count", "flag", "wait", "feat", "tokens", "name_filled");
        assertThat(result.schema().columnNames()).isEqualTo(pipeline.outputSchema().columnNames());
        assertThat(result.rowCount()).isEqualTo(3);

        assertThat(result.column("age")).containsExactly(
            List.of(30.0, 0.0), List.of(40.0, 1.0), List.of(50.0, 0.0));
        assertThat(result.column("count")).containsExactly(2, 0, 4);
        assertThat(result.column("flag")).containsExactly(
            List.of(true, false), List.of(false, true), List.of(false, false));
        assertThat(result.column("wait")).containsExactly(
            Duration.ofSeconds(10), Duration.ofSeconds(20), Duration.ofSeconds(30));
        assertThat(result.column("feat")).containsExactly(
            List.of(1f, 4f, 3f, 0f, 1f, 0f),
            List.of(2f, 2f, 5f, 1f, 0f, 0f),
            List.of(3f, 6f, 4f, 0f, 0f, 1f));
        assertThat(result.column("tokens")).containsExactly(
            List.of(1f, 0f), List.of(0f, 4f, 1f, 0f), List.of());
        assertThat(result.column("name_filled")).containsExactly("x", "", "z");
    }

    @Test
    @DisplayName("TC-E2E-002: The applied schema matches the composed output schema")
    void testSchemaMatchesData() {
        ComposedPipeline pipeline = composer.compose(
            ColumnRequestParser.parseJson("[{\"name\":\"age\"},{\"name\":\"f\",\"source\":\"feat\",\"kind\":\"max\",\"slot\":false}]"),
            PipelineDefaults.standard(), dataset);

        DatasetView result = pipeline.apply(dataset);

        assertThat(result.schema()).isEqualTo(pipeline.outputSchema());
        assertThat(result.schema().field(0).dataType()).isEqualTo(new VectorType(DoubleType.get(), 2));
        assertThat(result.column("f").get(0)).isEqualTo(List.of(1f, 6f, 3f, 0f, 1f, 0f));
    }

    @Test
    @DisplayName("TC-E2E-003: Pipelines refuse data of another schema")
    void testSchemaMismatch() {
        ComposedPipeline pipeline = composer.compose(
            ColumnRequestParser.parseAll(List.of("age")), PipelineDefaults.standard(), dataset);
        InMemoryDataset other = InMemoryDataset.builder(SchemaParser.parse("struct<age:double>"))
            .addRow(1.0)
            .build();

        assertThatThrownBy(() -> pipeline.apply(other))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("composed for");
    }

    @Test
    @DisplayName("TC-E2E-004: Input data is left unchanged")
    void testInputUnchanged() {
        ComposedPipeline pipeline = composer.compose(
            ColumnRequestParser.parseAll(List.of("age,kind=max")), PipelineDefaults.standard(), dataset);

        pipeline.apply(dataset);

        assertThat(dataset.column("age")).containsExactly(30.0, null, 50.0);
        assertThat(dataset.schema()).isEqualTo(Schemas.mixed());
    }
}
