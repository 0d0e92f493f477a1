package net.normalheston.validation;

import net.normalheston.montecarlo.MonteCarloConfiguration.RepetitionReduction;
import net.normalheston.montecarlo.MonteCarloValuation;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class PricingResultTest {

    @Test
    public void testDifferenceInStandardErrors() {
        MonteCarloValuation valuation = new MonteCarloValuation(new double[] { 0.105 }, RepetitionReduction.AVERAGE, 0.105, 0.002, 1000, 0);
        PricingResult result = new PricingResult(valuation, 0.1);

        assertEquals(0.005, result.getDifference(), 1E-15);
        assertEquals(2.5, result.getDifferenceInStandardErrors(), 1E-12);
    }

    @Test
    public void testDifferenceInStandardErrorsWithoutStandardError() {
        // Zero variance: every path pays the same amount.
        MonteCarloValuation valuation = new MonteCarloValuation(new double[] { 0.0 }, RepetitionReduction.AVERAGE, 0.0, 0.0, 1000, 1000);

        assertTrue(Double.isNaN(new PricingResult(valuation, 0.0).getDifferenceInStandardErrors()));
        assertTrue(Double.isNaN(new PricingResult(valuation, 1E-3).getDifferenceInStandardErrors()));
    }
}
