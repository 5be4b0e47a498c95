package com.optics.osg.refraction;

/**
 * Refractive-index model of a medium, evaluated at a vacuum wavelength in
 * metres.
 */
public interface RefractiveIndex {

    RefractiveIndex VACUUM = new ConstantIndex(1.0);

    /**
     * @throws com.optics.osg.api.OpticException if the wavelength lies outside
     *                                            the model's valid range
     */
    double at(double wavelength);
}
