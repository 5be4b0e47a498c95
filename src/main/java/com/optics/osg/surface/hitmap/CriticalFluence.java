package com.optics.osg.surface.hitmap;

import java.util.UUID;

/**
 * A bundle whose peak fluence on a surface exceeded the surface's damage
 * threshold.
 */
public record CriticalFluence(UUID bundleId, int bounce, double peakFluence, double lidt) {
}
