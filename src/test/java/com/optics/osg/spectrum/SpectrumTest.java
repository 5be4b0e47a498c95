package com.optics.osg.spectrum;

import org.junit.Test;

import static org.junit.Assert.*;

import com.optics.osg.api.OpticException;

public class SpectrumTest {

    @Test
    public void testHeNeLine() {
        Spectrum s = Spectra.heNe(1.0);
        assertEquals(1.0, s.totalEnergy(), 1e-12);
        assertEquals(632.816e-9, s.centerWavelength(), 1e-13);
        assertEquals(380e-9, s.start(), 0.0);
        assertTrue(s.end() < 750e-9);
    }

    @Test
    public void testPeakIsSplitBetweenNeighbours() {
        Spectrum s = new Spectrum(500e-9, 510e-9, 1e-9);
        s.addSinglePeak(502.25e-9, 1.0);
        assertEquals(0.75, s.value(2), 1e-9);
        assertEquals(0.25, s.value(3), 1e-9);
        assertEquals(0.0, s.value(4), 0.0);
        assertEquals(0.5, s.valueAt(502.5e-9), 1e-9);
        assertEquals(0.0, s.valueAt(600e-9), 0.0);
    }

    @Test
    public void testLorentzianKeepsEnergy() {
        Spectrum s = new Spectrum(1000e-9, 1100e-9, 0.1e-9).addLorentzian(1054e-9, 2e-9, 3.0);
        assertEquals(3.0, s.totalEnergy(), 1e-9);
        assertEquals(1054e-9, s.centerWavelength(), 1e-9);
    }

    @Test
    public void testSplitConservesEnergy() {
        Spectrum s = Spectra.heNe(2.0);
        Spectrum rest = s.split(0.3);
        assertEquals(0.6, s.totalEnergy(), 1e-12);
        assertEquals(1.4, rest.totalEnergy(), 1e-12);
        assertTrue(s.sameGrid(rest));
    }

    @Test
    public void testSplitByCurve() {
        Spectrum s = Spectra.heNe(1.0);
        Spectrum rest = s.split(Spectra.constant(370e-9, 760e-9, 1e-9, 0.25));
        assertEquals(0.25, s.totalEnergy(), 1e-9);
        assertEquals(0.75, rest.totalEnergy(), 1e-9);
    }

    @Test(expected = OpticException.class)
    public void testSplitRatioOutOfRange() {
        Spectra.heNe(1.0).split(1.5);
    }

    @Test
    public void testFilter() {
        Spectrum s = Spectra.heNe(1.0).filter(Spectra.constant(370e-9, 760e-9, 1e-9, 0.5));
        assertEquals(0.5, s.totalEnergy(), 1e-9);
    }

    @Test(expected = OpticException.class)
    public void testFilterAboveOneRejected() {
        Spectra.heNe(1.0).filter(Spectra.constant(370e-9, 760e-9, 1e-9, 1.5));
    }

    @Test
    public void testMergeOnSameGrid() {
        Spectrum s = Spectra.heNe(1.0).merge(Spectra.heNe(0.5));
        assertEquals(1.5, s.totalEnergy(), 1e-12);
        assertEquals(632.816e-9, s.centerWavelength(), 1e-13);
    }

    @Test
    public void testMergeSpansBothRanges() {
        Spectrum hene = Spectra.heNe(1.0);
        Spectrum s = hene.merge(Spectra.singleLine(1064e-9, 1.0));
        assertNotSame(hene, s);
        assertEquals(2.0, s.totalEnergy(), 1e-12);
        assertEquals(380e-9, s.start(), 1e-15);
        assertTrue(s.end() > 1073.8e-9);
        assertEquals(1.0, hene.totalEnergy(), 1e-12);
        assertEquals((632.816e-9 + 1064e-9) / 2.0, s.centerWavelength(), 1e-12);
    }

    @Test
    public void testMergeUsesFinerResolution() {
        Spectrum wide = new Spectrum(1000e-9, 1100e-9, 1e-9);
        Spectrum s = wide.merge(Spectra.singleLine(1064e-9, 2.0));
        assertEquals(Spectra.DEFAULT_RESOLUTION, s.resolution(), 0.0);
        assertEquals(1000e-9, s.start(), 1e-15);
        assertEquals(2.0, s.totalEnergy(), 1e-12);
        assertEquals(1064e-9, s.centerWavelength(), 1e-12);
    }

    @Test
    public void testResampleDropsOutOfRangeEnergy() {
        Spectrum s = Spectra.singleLine(1064e-9, 1.0).resample(600e-9, 700e-9, 1e-9);
        assertEquals(0.0, s.totalEnergy(), 0.0);
    }

    @Test
    public void testResample() {
        Spectrum s = Spectra.heNe(1.0).resample(600e-9, 700e-9, 1e-9);
        assertEquals(1.0, s.totalEnergy(), 1e-12);
        assertEquals(632.816e-9, s.centerWavelength(), 1e-12);
        assertEquals(1e-9, s.resolution(), 0.0);
    }

    @Test
    public void testEqualsAndCopy() {
        Spectrum s = Spectra.heNe(1.0);
        Spectrum copy = s.copy();
        assertEquals(s, copy);
        assertEquals(s.hashCode(), copy.hashCode());
        copy.scale(2.0);
        assertNotEquals(s, copy);
        assertEquals(1.0, s.totalEnergy(), 1e-12);
    }

    @Test
    public void testEmptySpectrumHasNoCenter() {
        assertTrue(Double.isNaN(new Spectrum(500e-9, 510e-9, 1e-9).centerWavelength()));
    }

    @Test(expected = OpticException.class)
    public void testEndBeforeStart() {
        new Spectrum(600e-9, 500e-9, 1e-9);
    }

    @Test(expected = OpticException.class)
    public void testNonPositiveResolution() {
        new Spectrum(500e-9, 600e-9, 0.0);
    }

    @Test(expected = OpticException.class)
    public void testPeakOutsideRange() {
        Spectra.heNe(1.0).addSinglePeak(1064e-9, 1.0);
    }

    @Test(expected = OpticException.class)
    public void testNegativeEnergy() {
        new Spectrum(500e-9, 600e-9, 1e-9).addSinglePeak(550e-9, -1.0);
    }
}
