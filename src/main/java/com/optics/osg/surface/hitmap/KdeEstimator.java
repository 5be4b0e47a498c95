package com.optics.osg.surface.hitmap;

import java.util.List;

import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.index.strtree.STRtree;

import com.optics.osg.api.OpticException;

/**
 * Kernel density estimate of the hit energy with an isotropic Gaussian kernel.
 *
 * <p>
 * The bandwidth follows Scott's rule for two dimensions,
 * {@code h = σ n^(-1/6)}, where {@code σ} is the mean of the x and y position
 * standard deviations. Kernels are cut off at 4h.
 */
final class KdeEstimator {
    private static final double CUTOFF = 4.0;

    private final List<HitPoint> points;
    private final double bandwidth;
    private final STRtree index = new STRtree();

    KdeEstimator(List<HitPoint> points) {
        if (points.size() < 2)
            throw OpticException.other("Too few points (<2) on hitmap to estimate a kernel bandwidth!");
        this.points = points;
        this.bandwidth = estimateBandwidth(points);
        for (HitPoint p : points)
            index.insert(new Envelope(p.x(), p.x(), p.y(), p.y()), p);
        index.build();
    }

    static double estimateBandwidth(List<HitPoint> points) {
        int n = points.size();
        double mx = 0.0, my = 0.0;
        for (HitPoint p : points) {
            mx += p.x();
            my += p.y();
        }
        mx /= n;
        my /= n;
        double vx = 0.0, vy = 0.0;
        for (HitPoint p : points) {
            vx += (p.x() - mx) * (p.x() - mx);
            vy += (p.y() - my) * (p.y() - my);
        }
        double sigma = (Math.sqrt(vx / n) + Math.sqrt(vy / n)) / 2.0;
        if (!(sigma > 0.0))
            throw OpticException.other("cannot estimate a kernel bandwidth for coincident hit points");
        return sigma * Math.pow(n, -1.0 / 6.0);
    }

    double bandwidth() {
        return bandwidth;
    }

    double valueAt(double x, double y) {
        double reach = CUTOFF * bandwidth;
        double h2 = bandwidth * bandwidth;
        double norm = 1.0 / (2.0 * Math.PI * h2);
        @SuppressWarnings("unchecked")
        List<HitPoint> near = index.query(new Envelope(x - reach, x + reach, y - reach, y + reach));
        double sum = 0.0;
        for (HitPoint p : near) {
            double dx = p.x() - x, dy = p.y() - y;
            double r2 = dx * dx + dy * dy;
            if (r2 <= reach * reach)
                sum += p.energy() * norm * Math.exp(-r2 / (2.0 * h2));
        }
        return sum;
    }

    FluenceData map(AxisRange xRange, AxisRange yRange, int nx, int ny) {
        AxisRange xr = xRange != null ? xRange : AxisRange.of(points, HitPoint::x).expand(3.0 * bandwidth);
        AxisRange yr = yRange != null ? yRange : AxisRange.of(points, HitPoint::y).expand(3.0 * bandwidth);
        double[] xs = xr.linspace(nx);
        double[] ys = yr.linspace(ny);
        double[][] values = new double[ny][nx];
        for (int row = 0; row < ny; row++)
            for (int col = 0; col < nx; col++)
                values[row][col] = valueAt(xs[col], ys[row]);
        return new FluenceData(values, xr, yr, FluenceEstimator.KDE);
    }

    double average() {
        double sumE = 0.0, sumEF = 0.0;
        for (HitPoint p : points) {
            sumE += p.energy();
            sumEF += p.energy() * valueAt(p.x(), p.y());
        }
        return sumE > 0.0 ? sumEF / sumE : 0.0;
    }
}
