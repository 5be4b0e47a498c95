package com.optics.osg.surface.hitmap;

import java.util.List;
import java.util.UUID;

import org.junit.Test;

import static org.junit.Assert.*;

public class HitMapTest {

    @Test
    public void testHitsGroupedByBounceAndBundle() {
        HitMap map = new HitMap();
        UUID a = UUID.randomUUID();
        UUID b = UUID.randomUUID();
        map.add(0, a, HitPoint.ofEnergy(0.0, 0.0, 1.0));
        map.add(0, a, HitPoint.ofEnergy(1.0, 0.0, 1.0));
        map.add(1, b, HitPoint.ofEnergy(0.0, 1.0, 1.0));

        assertEquals(3, map.size());
        assertEquals(2, map.get(0, a).size());
        assertNull(map.get(1, a));
        assertEquals(List.of(0, 1), map.bounceLevels());
        map.reset();
        assertTrue(map.isEmpty());
    }

    @Test
    public void testCriticalFluenceRecordedOncePerBundleAndBounce() {
        HitMap map = new HitMap();
        UUID bundle = UUID.randomUUID();

        assertTrue(map.addCriticalFluence(new CriticalFluence(bundle, 0, 2e4, 1e4)));
        assertFalse(map.addCriticalFluence(new CriticalFluence(bundle, 0, 3e4, 1e4)));
        assertEquals(1, map.criticalFluences().size());
        assertEquals(3e4, map.criticalFluences().get(0).peakFluence(), 0.0);

        assertTrue(map.addCriticalFluence(new CriticalFluence(bundle, 1, 2e4, 1e4)));
        assertTrue(map.addCriticalFluence(new CriticalFluence(UUID.randomUUID(), 0, 2e4, 1e4)));
        assertEquals(3, map.criticalFluences().size());

        map.reset();
        assertTrue(map.criticalFluences().isEmpty());
    }
}
