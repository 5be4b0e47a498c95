package com.optics.osg.node;

import java.util.List;

/** Port names shared by the node catalogue. */
public final class OpticPorts {
    private OpticPorts() {
        // Utility class
    }

    public static final String INPUT_1 = "input_1";
    public static final String INPUT_2 = "input_2";
    public static final String OUTPUT_1 = "output_1";

    /** Beam splitter exit carrying the transmitted part of input 1 and the reflected part of input 2. */
    public static final String OUT1_TRANS1_REFL2 = "out1_trans1_refl2";
    /** Beam splitter exit carrying the transmitted part of input 2 and the reflected part of input 1. */
    public static final String OUT2_TRANS2_REFL1 = "out2_trans2_refl1";

    static final List<String> SINGLE_INPUT = List.of(INPUT_1);
    static final List<String> SINGLE_OUTPUT = List.of(OUTPUT_1);
}
