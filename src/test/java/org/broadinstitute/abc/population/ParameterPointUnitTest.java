package org.broadinstitute.abc.population;

import org.apache.commons.lang3.SerializationUtils;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.HashSet;

public final class ParameterPointUnitTest {

    @Test
    public void testGetAndNames() {
        final ParameterPoint point = new ParameterPoint(Arrays.asList(new Parameter("a", 1.), new Parameter("b", 2.)));
        Assert.assertEquals(point.get("a"), 1.);
        Assert.assertEquals(point.get("b"), 2.);
        Assert.assertEquals(point.size(), 2);
        Assert.assertEquals(point.parameterNames(), new HashSet<>(Arrays.asList("a", "b")));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testDuplicateNames() {
        new ParameterPoint(Arrays.asList(new Parameter("a", 1.), new Parameter("a", 2.)));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testUnknownName() {
        ParameterPoint.of("x", 1., 2.).get("y");
    }

    @Test
    public void testOfAndWith() {
        final ParameterPoint point = ParameterPoint.of("x", 1., 2.);
        Assert.assertEquals(point.get("x0"), 1.);
        Assert.assertEquals(point.get("x1"), 2.);
        final ParameterPoint updated = point.with("x1", 5.);
        Assert.assertEquals(updated.get("x1"), 5.);
        Assert.assertEquals(point.get("x1"), 2., "original must be unchanged");
        Assert.assertNotEquals(updated, point);
    }

    @Test(expectedExceptions = UnsupportedOperationException.class)
    public void testWithUnknownName() {
        ParameterPoint.of("x", 1.).with("y", 2.);
    }

    @Test
    public void testEqualityAndSerialization() {
        final ParameterPoint point = ParameterPoint.of("x", 0.5, -3.);
        final ParameterPoint copy = SerializationUtils.roundtrip(point);
        Assert.assertEquals(copy, point);
        Assert.assertEquals(copy.hashCode(), point.hashCode());
    }
}
