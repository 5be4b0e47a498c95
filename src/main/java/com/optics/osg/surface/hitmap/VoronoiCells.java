package com.optics.osg.surface.hitmap;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.index.strtree.STRtree;
import org.locationtech.jts.operation.overlayng.OverlayNG;
import org.locationtech.jts.operation.overlayng.OverlayNGRobust;
import org.locationtech.jts.triangulate.VoronoiDiagramBuilder;

import com.optics.osg.api.OpticException;

/**
 * Voronoi tessellation of hit points, clipped to their bounding box grown by
 * half the mean point spacing.
 *
 * <p>
 * Coincident hit points are merged into one site; their energies add up and
 * their fluences are averaged with energy weights.
 */
final class VoronoiCells {
    private static final GeometryFactory GF = new GeometryFactory();
    /** Sites closer than this fraction of the mean spacing are snapped together. */
    private static final double SNAP_TOLERANCE = 1e-9;

    private final List<Coordinate> sites = new ArrayList<>();
    private final List<double[]> siteValues = new ArrayList<>(); // {energy, fluence*energy}
    private final double[] cellArea;
    private final STRtree index = new STRtree();

    VoronoiCells(List<HitPoint> points) {
        if (points.size() < 3)
            throw OpticException.other("Too few points (<3) on hitmap to calculate fluence!");
        Map<Coordinate, double[]> merged = new LinkedHashMap<>();
        for (HitPoint p : points) {
            double[] v = merged.computeIfAbsent(new Coordinate(p.x(), p.y()), c -> new double[2]);
            v[0] += p.energy();
            v[1] += p.hasFluence() ? p.fluence() * p.energy() : 0.0;
        }
        if (merged.size() < 3)
            throw OpticException.other("Too few points (<3) on hitmap to calculate fluence!");
        Map<Coordinate, Integer> siteIndex = new LinkedHashMap<>();
        for (var e : merged.entrySet()) {
            siteIndex.put(e.getKey(), sites.size());
            sites.add(e.getKey());
            siteValues.add(e.getValue());
        }
        Envelope env = new Envelope();
        for (Coordinate c : sites)
            env.expandToInclude(c);
        if (env.getWidth() <= 0.0 || env.getHeight() <= 0.0)
            throw OpticException.other("Voronoi diagram for fluence estimation could not be created: hit points are collinear");
        double spacing = Math.sqrt(env.getArea() / sites.size());
        env.expandBy(0.5 * spacing);
        Geometry clip = GF.toGeometry(env);

        VoronoiDiagramBuilder builder = new VoronoiDiagramBuilder();
        builder.setSites(sites);
        builder.setTolerance(SNAP_TOLERANCE * spacing);
        cellArea = new double[sites.size()];
        try {
            // unclipped cells; border cells are cut to the envelope with the snapping overlay
            Geometry diagram = builder.getSubdivision().getVoronoiDiagram(GF);
            for (int i = 0; i < diagram.getNumGeometries(); i++) {
                Geometry cell = diagram.getGeometryN(i);
                Integer site = cell.getUserData() instanceof Coordinate c ? siteIndex.get(c) : null;
                if (site == null)
                    continue;
                if (!env.contains(cell.getEnvelopeInternal()))
                    cell = OverlayNGRobust.overlay(cell, clip, OverlayNG.INTERSECTION);
                if (cell.isEmpty() || cell.getArea() <= 0.0)
                    continue;
                cellArea[site] = cell.getArea();
                index.insert(cell.getEnvelopeInternal(), new IndexedCell(site, cell));
            }
        } catch (RuntimeException e) {
            throw new OpticException(OpticException.Kind.OTHER,
                    "Voronoi diagram for fluence estimation could not be created: " + e.getMessage(), e);
        }
        index.build();
    }

    private record IndexedCell(int site, Geometry cell) {
    }

    int siteCount() {
        return sites.size();
    }

    double energy(int site) {
        return siteValues.get(site)[0];
    }

    /** Energy of the site divided by the area of its cell, 0 for degenerate cells. */
    double energyFluence(int site) {
        return cellArea[site] > 0.0 ? energy(site) / cellArea[site] : 0.0;
    }

    /** Energy-weighted mean of the fluences carried by the merged hit points. */
    double carriedFluence(int site) {
        double e = energy(site);
        return e > 0.0 ? siteValues.get(site)[1] / e : 0.0;
    }

    /** Index of the cell containing (x, y), -1 if outside the clipped diagram. */
    int siteAt(double x, double y) {
        Point pt = GF.createPoint(new Coordinate(x, y));
        @SuppressWarnings("unchecked")
        List<IndexedCell> candidates = index.query(new Envelope(x, x, y, y));
        for (IndexedCell c : candidates)
            if (c.cell().covers(pt))
                return c.site();
        return -1;
    }

    AxisRange xRange() {
        return AxisRange.of(sites, c -> c.x);
    }

    AxisRange yRange() {
        return AxisRange.of(sites, c -> c.y);
    }
}
