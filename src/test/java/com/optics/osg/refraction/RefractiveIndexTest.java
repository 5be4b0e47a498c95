package com.optics.osg.refraction;

import org.junit.Test;

import static org.junit.Assert.*;

import com.optics.osg.api.OpticException;

public class RefractiveIndexTest {

    @Test
    public void testConstant() {
        RefractiveIndex n = new ConstantIndex(1.5);
        assertEquals(1.5, n.at(400e-9), 0.0);
        assertEquals(1.5, n.at(10e-6), 0.0);
        assertEquals(1.0, RefractiveIndex.VACUUM.at(1064e-9), 0.0);
    }

    @Test(expected = OpticException.class)
    public void testConstantBelowOne() {
        new ConstantIndex(0.9);
    }

    @Test
    public void testSchott() {
        SchottIndex n = new SchottIndex(3.26760058, -2.05384566e-2, 3.51507672e-2, 7.70151348e-3, -9.08139817e-4,
                7.52649555e-5, 300e-9, 2500e-9);
        assertEquals(1.81164, n.at(1054e-9), 1e-4);
        assertTrue(n.toString().startsWith("Schott[3.26760058"));
    }

    @Test
    public void testSchottOutsideRange() {
        SchottIndex n = new SchottIndex(3.26760058, -2.05384566e-2, 3.51507672e-2, 7.70151348e-3, -9.08139817e-4,
                7.52649555e-5, 300e-9, 2500e-9);
        try {
            n.at(3000e-9);
            fail("3 µm is outside the fit range");
        } catch (OpticException e) {
            assertEquals(OpticException.Kind.OTHER, e.kind());
        }
    }

    @Test
    public void testNbk7() {
        Sellmeier1Index bk7 = Sellmeier1Index.nbk7();
        assertEquals(1.5168, bk7.at(587.56e-9), 1e-4);
        // normal dispersion
        assertTrue(bk7.at(400e-9) > bk7.at(800e-9));
    }

    @Test
    public void testConrady() {
        ConradyIndex n = new ConradyIndex(1.5, 0.01, 0.0, 400e-9, 2000e-9);
        assertEquals(1.51, n.at(1e-6), 1e-12);
        assertEquals(1.52, n.at(0.5e-6), 1e-12);
    }

    @Test(expected = OpticException.class)
    public void testEmptyRange() {
        new ConradyIndex(1.5, 0.01, 0.0, 800e-9, 400e-9);
    }
}
