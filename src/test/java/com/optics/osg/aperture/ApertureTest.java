package com.optics.osg.aperture;

import org.junit.Test;

import static org.junit.Assert.*;

import com.optics.osg.api.OpticException;

public class ApertureTest {

    @Test
    public void testNone() {
        assertTrue(Aperture.NONE.transmits(1e3, -1e3));
    }

    @Test
    public void testCircle() {
        Aperture a = new CircleAperture(1.0, 1.0, 0.0);
        assertTrue(a.transmits(1.0, 0.0));
        assertTrue(a.transmits(2.0, 0.0)); // rim
        assertFalse(a.transmits(0.0, 0.5));
    }

    @Test
    public void testRectangle() {
        Aperture a = new RectangleAperture(2.0, 1.0);
        assertTrue(a.transmits(1.0, 0.5));
        assertTrue(a.transmits(-0.9, -0.4));
        assertFalse(a.transmits(0.0, 0.6));
        assertFalse(a.transmits(1.1, 0.0));
    }

    @Test
    public void testPolygon() {
        PolygonAperture a = PolygonAperture.of(new double[][] { { 0, 0 }, { 2, 0 }, { 0, 2 } });
        assertTrue(a.transmits(0.5, 0.5));
        assertTrue(a.transmits(1.0, 1.0)); // on the hypotenuse
        assertFalse(a.transmits(1.5, 1.5));
        assertFalse(a.transmits(-0.1, 0.5));
        assertEquals(4, a.polygon().getNumPoints());
    }

    @Test
    public void testClosedOutlineIsNotClosedTwice() {
        PolygonAperture a = PolygonAperture.of(new double[][] { { 0, 0 }, { 1, 0 }, { 1, 1 }, { 0, 1 }, { 0, 0 } });
        assertEquals(5, a.polygon().getNumPoints());
        assertTrue(a.transmits(0.5, 0.5));
    }

    @Test(expected = OpticException.class)
    public void testPolygonNeedsThreeVertices() {
        PolygonAperture.of(new double[][] { { 0, 0 }, { 1, 0 } });
    }

    @Test
    public void testStack() {
        Aperture a = StackedAperture.of(new CircleAperture(1.0), new RectangleAperture(1.0, 4.0));
        assertTrue(a.transmits(0.4, 0.8));
        assertFalse(a.transmits(0.6, 0.0));
        assertFalse(a.transmits(0.0, 1.5));
    }

    @Test
    public void testInverted() {
        Aperture circle = new CircleAperture(1.0);
        Aperture stop = circle.inverted();
        assertFalse(stop.transmits(0.0, 0.0));
        assertTrue(stop.transmits(2.0, 0.0));
        assertSame(circle, stop.inverted());
    }

    @Test(expected = OpticException.class)
    public void testCircleRadius() {
        new CircleAperture(0.0);
    }
}
