package net.normalheston.model;

import net.normalheston.TestProperties;
import org.junit.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class NormalHestonModelTest {

    @Test
    public void testFromProperties() throws Exception {
        NormalHestonModel model = NormalHestonModel.fromProperties(TestProperties.load("normal-heston-scenario.properties"));

        assertEquals(-0.001, model.getInitialValue(), 0.0);
        assertEquals(0.0, model.getStrike(), 0.0);
        assertEquals(1.0, model.getMaturity(), 0.0);
        assertEquals(0.09, model.getInitialVariance(), 0.0);
        assertEquals(5E-7, model.getLongRunVariance(), 0.0);
        assertEquals(1.0, model.getMeanReversionSpeed(), 0.0);
        assertEquals(0.25, model.getVolatilityOfVariance(), 0.0);
        assertEquals(-0.9, model.getCorrelation(), 0.0);
    }

    @Test
    public void testRatesDefaultToZero() {
        Map<String, Object> properties = new HashMap<>();
        properties.put("initialValue", 1.0);
        properties.put("strike", 1.0);
        properties.put("maturity", 1.0);
        properties.put("initialVariance", 0.04);
        properties.put("longRunVariance", 0.04);
        properties.put("meanReversionSpeed", 1.0);
        properties.put("volatilityOfVariance", "0.3");
        properties.put("correlation", 0.0);

        NormalHestonModel model = NormalHestonModel.fromProperties(properties);

        assertEquals(0.0, model.getRiskFreeRate(), 0.0);
        assertEquals(0.0, model.getDividendYield(), 0.0);
        assertEquals(0.3, model.getVolatilityOfVariance(), 0.0);
    }

    @Test
    public void testMissingPropertyIsRejected() {
        Map<String, Object> properties = new HashMap<>();
        properties.put("initialValue", 1.0);
        try {
            NormalHestonModel.fromProperties(properties);
            fail("Missing properties have to be rejected.");
        }
        catch(IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("strike"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidCorrelationIsRejected() {
        new NormalHestonModel(-0.001, 0.0, 1.0, 0.0, 0.0, 0.09, 5E-7, 1.0, 0.25, 1.5);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeInitialVarianceIsRejected() {
        new NormalHestonModel(0.0, 0.0, 1.0, 0.0, 0.0, -0.01, 0.04, 1.0, 0.25, 0.0);
    }

    @Test
    public void testFellerCondition() {
        NormalHestonModel violating = new NormalHestonModel(-0.001, 0.0, 1.0, 0.0, 0.0, 0.09, 5E-7, 1.0, 0.25, -0.9);
        NormalHestonModel satisfying = new NormalHestonModel(0.0, 0.0, 1.0, 0.0, 0.0, 0.04, 0.04, 2.0, 0.3, -0.5);

        assertFalse(violating.isFellerConditionSatisfied());
        assertTrue(satisfying.isFellerConditionSatisfied());
    }

    @Test
    public void testCloneWithModifiedStrike() {
        NormalHestonModel model = new NormalHestonModel(0.0, 0.0, 1.0, 0.02, 0.0, 0.04, 0.04, 2.0, 0.3, -0.5);
        NormalHestonModel clone = model.getCloneWithModifiedStrike(0.1);

        assertEquals(0.1, clone.getStrike(), 0.0);
        assertEquals(model.getRiskFreeRate(), clone.getRiskFreeRate(), 0.0);
        assertEquals(model.getCorrelation(), clone.getCorrelation(), 0.0);
    }
}
