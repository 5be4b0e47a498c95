package com.optics.osg.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.Data;

import com.optics.osg.api.OpticException;
import com.optics.osg.engine.Analyzer;
import com.optics.osg.engine.AnalyzerType;
import com.optics.osg.engine.EnergyAnalyzer;
import com.optics.osg.engine.GhostFocusAnalyzer;
import com.optics.osg.engine.GhostFocusConfig;
import com.optics.osg.engine.RayTraceAnalyzer;
import com.optics.osg.engine.RayTraceConfig;
import com.optics.osg.ray.MissedSurfaceStrategy;

/**
 * Analyzer selection as read from JSON, e.g.
 * {@code {"analyzer":"GHOST_FOCUS","maxBounces":2}}. Unset fields keep the
 * defaults of the matching config.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AnalyzerSettings {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private AnalyzerType analyzer = AnalyzerType.ENERGY;
    private Double minEnergyPerRay;
    private Integer maxBounces, maxRefractions;
    private MissedSurfaceStrategy missedSurface;

    public static AnalyzerSettings fromJson(String json) {
        try {
            return MAPPER.readValue(json, AnalyzerSettings.class);
        } catch (IOException e) {
            throw new OpticException(OpticException.Kind.OTHER, "invalid analyzer settings: " + e.getMessage(), e);
        }
    }

    public static AnalyzerSettings fromFile(Path path) throws IOException {
        return fromJson(Files.readString(path));
    }

    /**
     * Builds the analyzer. For ghost-focus analysis {@code maxBounces} is the
     * ghost bounce limit, otherwise the ray-trace bounce limit.
     */
    public Analyzer toAnalyzer() {
        if (analyzer == null)
            throw OpticException.other("analyzer type missing");
        switch (analyzer) {
            case ENERGY:
                return new EnergyAnalyzer();
            case RAY_TRACE:
                return new RayTraceAnalyzer(rayTraceConfig(true));
            case GHOST_FOCUS:
                GhostFocusConfig ghost = maxBounces != null ? new GhostFocusConfig(maxBounces)
                        : GhostFocusConfig.defaults();
                return new GhostFocusAnalyzer(ghost, rayTraceConfig(false));
            default:
                throw OpticException.other("unsupported analyzer " + analyzer);
        }
    }

    private RayTraceConfig rayTraceConfig(boolean withBounces) {
        RayTraceConfig cfg = RayTraceConfig.defaults();
        if (minEnergyPerRay != null)
            cfg = cfg.withMinEnergyPerRay(minEnergyPerRay);
        if (withBounces && maxBounces != null)
            cfg = cfg.withMaxBounces(maxBounces);
        if (maxRefractions != null)
            cfg = cfg.withMaxRefractions(maxRefractions);
        if (missedSurface != null)
            cfg = cfg.withMissedSurface(missedSurface);
        return cfg;
    }
}
