package com.optics.osg.aperture;

/**
 * Binary transmission mask in the local x/y plane of a surface.
 *
 * <p>
 * A ray whose local hit point is not transmitted is invalidated when the
 * bundle is apodized.
 */
public interface Aperture {

    /** Transmits everything. */
    Aperture NONE = new Aperture() {
        @Override
        public boolean transmits(double x, double y) {
            return true;
        }

        @Override
        public String toString() {
            return "None";
        }
    };

    boolean transmits(double x, double y);

    /** Obstruction of the same shape: transmits exactly where this one blocks. */
    default Aperture inverted() {
        return new InvertedAperture(this);
    }
}
