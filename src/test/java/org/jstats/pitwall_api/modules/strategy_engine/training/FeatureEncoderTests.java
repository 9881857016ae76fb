package org.jstats.pitwall_api.modules.strategy_engine.training;

import org.jstats.pitwall_api.modules.strategy_engine.domain.FeatureSchema;
import org.jstats.pitwall_api.modules.strategy_engine.domain.StrategyDomain;
import org.jstats.pitwall_api.modules.strategy_engine.exception.SchemaException;
import org.jstats.pitwall_api.modules.strategy_engine.model.PitStopRequest;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FeatureEncoderTests {

    private final FeatureEncoder encoder = new FeatureEncoder();

    @Test
    void encodesInSchemaOrder_regardlessOfMapOrder() {
        FeatureSchema schema = FeatureSchema.of("b", "a", "c");
        Map<String, Double> features = new HashMap<>(Map.of("a", 1.0, "b", 2.0, "c", 3.0));

        assertArrayEquals(new double[]{2.0, 1.0, 3.0}, encoder.encode(schema, features));
    }

    @Test
    void missingFeature_namesTheField() {
        SchemaException ex = assertThrows(SchemaException.class,
                () -> encoder.encode(FeatureSchema.of("a", "b"), Map.of("a", 1.0)));

        assertEquals("b", ex.getField());
    }

    @Test
    void nullValue_isTreatedAsMissing() {
        Map<String, Double> features = new HashMap<>();
        features.put("a", null);

        assertThrows(SchemaException.class, () -> encoder.encode(FeatureSchema.of("a"), features));
    }

    @Test
    void requestDefaults_coverTheWholePitStopSchema() {
        double[] x = encoder.encode(StrategyDomain.PIT_STOP.schema(), PitStopRequest.defaults().toFeatures());

        assertEquals(20, x.length);
        assertEquals(22.0, x[StrategyDomain.PIT_STOP.schema().names().indexOf("pit_delta")]);
    }
}
