package com.optics.osg.aperture;

import org.locationtech.jts.algorithm.locate.IndexedPointInAreaLocator;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Location;
import org.locationtech.jts.geom.Polygon;

import com.optics.osg.api.OpticException;

/**
 * Opening of arbitrary polygonal shape (holes allowed), backed by a JTS
 * {@link Polygon}. Boundary points are transmitted.
 */
public final class PolygonAperture implements Aperture {
    private static final GeometryFactory GF = new GeometryFactory();

    private final Polygon polygon;
    private final IndexedPointInAreaLocator locator;

    public PolygonAperture(Polygon polygon) {
        if (polygon == null || polygon.isEmpty() || !polygon.isValid())
            throw OpticException.other("aperture polygon must be a valid, non-empty polygon");
        this.polygon = polygon;
        this.locator = new IndexedPointInAreaLocator(polygon);
    }

    /** Builds the polygon from an open or closed outline given as {x, y} pairs. */
    public static PolygonAperture of(double[][] outline) {
        if (outline.length < 3)
            throw OpticException.other("aperture polygon needs at least three vertices");
        boolean closed = outline[0][0] == outline[outline.length - 1][0]
                && outline[0][1] == outline[outline.length - 1][1];
        int n = closed ? outline.length : outline.length + 1;
        Coordinate[] ring = new Coordinate[n];
        for (int i = 0; i < outline.length; i++)
            ring[i] = new Coordinate(outline[i][0], outline[i][1]);
        if (!closed)
            ring[n - 1] = new Coordinate(ring[0]);
        return new PolygonAperture(GF.createPolygon(ring));
    }

    public Polygon polygon() {
        return polygon;
    }

    @Override
    public boolean transmits(double x, double y) {
        return locator.locate(new Coordinate(x, y)) != Location.EXTERIOR;
    }

    @Override
    public String toString() {
        return "Polygon(" + polygon.getNumPoints() + " points)";
    }
}
