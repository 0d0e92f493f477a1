package net.normalheston;

import org.junit.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class PropertyUtilsTest {

    @Test
    public void testConversions() {
        Map<String, Object> properties = new HashMap<>();
        properties.put("double", " 0.25 ");
        properties.put("number", 3);
        properties.put("long", "12345678901");

        assertEquals(0.25, PropertyUtils.getRequiredDouble(properties, "double"), 0.0);
        assertEquals(3.0, PropertyUtils.getRequiredDouble(properties, "number"), 0.0);
        assertEquals(3, PropertyUtils.getRequiredInt(properties, "number"));
        assertEquals(12345678901L, PropertyUtils.getLong(properties, "long", 0L));
        assertEquals(1.5, PropertyUtils.getDouble(properties, "missing", 1.5), 0.0);
        assertEquals("x", PropertyUtils.getString(properties, "missing", "x"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingRequiredProperty() {
        PropertyUtils.getRequiredDouble(new HashMap<String, Object>(), "initialValue");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMalformedNumber() {
        Map<String, Object> properties = new HashMap<>();
        properties.put("gridSize", "many");
        PropertyUtils.getRequiredInt(properties, "gridSize");
    }

    @Test
    public void testLongOutsideIntRangeIsRejected() {
        Map<String, Object> properties = new HashMap<>();
        properties.put("numberOfPaths", 3_000_000_000L);
        properties.put("numberOfTimeSteps", 100L);

        assertEquals(100, PropertyUtils.getRequiredInt(properties, "numberOfTimeSteps"));
        try {
            PropertyUtils.getRequiredInt(properties, "numberOfPaths");
            fail("3000000000 does not fit into an int.");
        }
        catch(IllegalArgumentException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("numberOfPaths"));
        }
    }
}
