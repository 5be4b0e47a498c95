package com.optics.osg.engine;

import lombok.Builder;
import lombok.Getter;

import com.optics.osg.api.OpticException;
import com.optics.osg.refraction.RefractiveIndex;
import com.optics.osg.surface.hitmap.FluenceEstimator;

/**
 * Scene-wide settings shared by all nodes during a run: the medium the scene
 * is immersed in, the wavelength of the alignment rays and the estimator used
 * for damage-threshold checks. Immutable.
 */
@Getter
public final class SceneryResources {
    public static final double DEFAULT_ALIGNMENT_WAVELENGTH = 1000e-9;

    private final RefractiveIndex ambientIndex;
    private final double alignmentWavelength;
    private final FluenceEstimator fluenceEstimator;

    @Builder(toBuilder = true)
    private SceneryResources(RefractiveIndex ambientIndex, Double alignmentWavelength,
            FluenceEstimator fluenceEstimator) {
        this.ambientIndex = ambientIndex != null ? ambientIndex : RefractiveIndex.VACUUM;
        this.alignmentWavelength = alignmentWavelength != null ? alignmentWavelength : DEFAULT_ALIGNMENT_WAVELENGTH;
        if (!Double.isFinite(this.alignmentWavelength) || this.alignmentWavelength <= 0.0)
            throw OpticException.other("alignment wavelength must be positive and finite");
        this.fluenceEstimator = fluenceEstimator != null ? fluenceEstimator : FluenceEstimator.VORONOI;
    }

    public static SceneryResources defaults() {
        return builder().build();
    }

    /** Ambient refractive index at the given wavelength. */
    public double ambientIndexAt(double wavelength) {
        return ambientIndex.at(wavelength);
    }
}
