package com.optics.osg.light;

/** Placeholder for wave-optical field data. No node can analyze it. */
public record FourierData() implements LightData {

    @Override
    public Kind kind() {
        return Kind.FOURIER;
    }

    @Override
    public FourierData copy() {
        return this;
    }
}
