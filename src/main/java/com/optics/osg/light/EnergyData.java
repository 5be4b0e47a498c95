package com.optics.osg.light;

import com.optics.osg.spectrum.Spectrum;

/** Spectral energy, used by energy analysis. */
public record EnergyData(Spectrum spectrum) implements LightData {

    @Override
    public Kind kind() {
        return Kind.ENERGY;
    }

    @Override
    public EnergyData copy() {
        return new EnergyData(spectrum.copy());
    }
}
