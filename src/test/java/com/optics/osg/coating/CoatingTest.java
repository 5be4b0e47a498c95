package com.optics.osg.coating;

import javax.vecmath.Vector3d;

import org.junit.Test;

import static org.junit.Assert.*;

import com.optics.osg.api.OpticException;

public class CoatingTest {
    private static final Vector3d AXIS = new Vector3d(0, 0, 1);
    private static final Vector3d NORMAL = new Vector3d(0, 0, -1);

    private static Vector3d tilted(double degrees) {
        double a = Math.toRadians(degrees);
        return new Vector3d(Math.sin(a), 0, Math.cos(a));
    }

    @Test
    public void testFresnelNormalIncidence() {
        assertEquals(0.04, FresnelCoating.INSTANCE.reflectivity(AXIS, NORMAL, 1.0, 1.5), 1e-12);
        // same from the glass side
        assertEquals(0.04, FresnelCoating.INSTANCE.reflectivity(AXIS, NORMAL, 1.5, 1.0), 1e-12);
    }

    @Test
    public void testFresnelOblique() {
        assertEquals(0.05024, FresnelCoating.INSTANCE.reflectivity(tilted(45), NORMAL, 1.0, 1.5), 1e-4);
    }

    @Test
    public void testFresnelIgnoresNormalOrientation() {
        double a = FresnelCoating.INSTANCE.reflectivity(tilted(30), NORMAL, 1.0, 1.5);
        double b = FresnelCoating.INSTANCE.reflectivity(tilted(30), AXIS, 1.0, 1.5);
        assertEquals(a, b, 1e-15);
    }

    @Test
    public void testTotalInternalReflection() {
        assertEquals(1.0, FresnelCoating.INSTANCE.reflectivity(tilted(60), NORMAL, 1.5, 1.0), 0.0);
    }

    @Test
    public void testEqualIndicesDoNotReflect() {
        assertEquals(0.0, FresnelCoating.INSTANCE.reflectivity(tilted(20), NORMAL, 1.5, 1.5), 1e-15);
    }

    @Test
    public void testIdealArAndConstant() {
        assertEquals(0.0, IdealArCoating.INSTANCE.reflectivity(tilted(45), NORMAL, 1.0, 1.5), 0.0);
        Coating c = new ConstantReflectivity(0.1);
        assertEquals(0.1, c.reflectivity(tilted(45), NORMAL, 1.0, 1.5), 0.0);
        assertEquals(0.1, c.reflectivity(AXIS, NORMAL, 1.5, 1.0), 0.0);
    }

    @Test(expected = OpticException.class)
    public void testConstantAboveOne() {
        new ConstantReflectivity(1.2);
    }

    @Test(expected = OpticException.class)
    public void testConstantNaN() {
        new ConstantReflectivity(Double.NaN);
    }
}
