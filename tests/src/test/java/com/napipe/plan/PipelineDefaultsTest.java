package com.napipe.plan;

import com.napipe.stage.StrategyKind;
import com.napipe.test.TestBase;
import com.napipe.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for pipeline defaults and their system-property configuration.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("PipelineDefaults Tests")
public class PipelineDefaultsTest extends TestBase {

    @Override
    protected void doTearDown() {
        System.clearProperty(PipelineDefaults.PROP_STRATEGY);
        System.clearProperty(PipelineDefaults.PROP_IMPUTE_BY_SLOT);
        System.clearProperty(PipelineDefaults.PROP_EMIT_INDICATOR);
    }

    @Test
    @DisplayName("Standard defaults replace with the default value, by slot, with indicator")
    void testStandard() {
        PipelineDefaults defaults = PipelineDefaults.standard();

        assertThat(defaults.strategy()).isEqualTo(StrategyKind.DEFAULT);
        assertThat(defaults.imputeBySlot()).isTrue();
        assertThat(defaults.emitIndicator()).isTrue();
    }

    @Test
    @DisplayName("Unset properties yield the standard defaults")
    void testNoProperties() {
        assertThat(PipelineDefaults.fromSystemProperties()).isEqualTo(PipelineDefaults.standard());
    }

    @Test
    @DisplayName("Properties override the standard defaults")
    void testPropertiesOverride() {
        System.setProperty(PipelineDefaults.PROP_STRATEGY, "Max");
        System.setProperty(PipelineDefaults.PROP_IMPUTE_BY_SLOT, "false");
        System.setProperty(PipelineDefaults.PROP_EMIT_INDICATOR, " FALSE ");

        assertThat(PipelineDefaults.fromSystemProperties())
            .isEqualTo(new PipelineDefaults(StrategyKind.MAXIMUM, false, false));
    }

    @Test
    @DisplayName("Unparseable properties are ignored")
    void testBadPropertiesIgnored() {
        System.setProperty(PipelineDefaults.PROP_STRATEGY, "median");
        System.setProperty(PipelineDefaults.PROP_EMIT_INDICATOR, "yes");

        assertThat(PipelineDefaults.fromSystemProperties()).isEqualTo(PipelineDefaults.standard());
    }

    @Test
    @DisplayName("With-methods change one setting")
    void testWithMethods() {
        PipelineDefaults defaults = PipelineDefaults.standard()
            .withStrategy(StrategyKind.MEAN)
            .withEmitIndicator(false);

        assertThat(defaults).isEqualTo(new PipelineDefaults(StrategyKind.MEAN, true, false));
        assertThat(defaults.withImputeBySlot(false).imputeBySlot()).isFalse();
    }
}
