package com.optics.osg.io;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO summary of an analysis run: the analyzer, the node reports and every
 * critical-fluence event found on the scene's surfaces.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class AnalysisReport {
    private String scene, analyzer;
    private double durationMillis;
    private int collectedBundles;
    private List<NodeReport> nodes = new ArrayList<>();
    private List<DamageEntry> criticalFluences = new ArrayList<>();

    /** A surface whose peak fluence exceeded its damage threshold. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class DamageEntry {
        private String node, surface, bundleId;
        private int bounce;
        private double peakFluence, lidt;
    }
}
