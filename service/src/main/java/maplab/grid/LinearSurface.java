package maplab.grid;

import java.util.OptionalDouble;
import org.apache.commons.math3.util.MathArrays;

/**
 * Piecewise-linear interpolant over a triangulation of scattered samples. Inside the convex hull
 * of the samples the value is the barycentric blend of the enclosing triangle's corners; outside
 * it there is no value.
 */
public final class LinearSurface {
  // barycentric weights down to this much below zero still count as inside
  private static final double EDGE_TOLERANCE = 1e-10;

  private final Triangulation triangulation;
  private final double[] values;
  private final double[][] bounds;

  private LinearSurface(Triangulation triangulation, double[] values) {
    this.triangulation = triangulation;
    this.values = values;
    this.bounds = new double[triangulation.size()][];
    for (int t = 0; t < triangulation.size(); t++) {
      int[] tri = triangulation.triangle(t);
      double minX = Double.POSITIVE_INFINITY;
      double maxX = Double.NEGATIVE_INFINITY;
      double minY = Double.POSITIVE_INFINITY;
      double maxY = Double.NEGATIVE_INFINITY;
      for (int v : tri) {
        minX = Math.min(minX, triangulation.x(v));
        maxX = Math.max(maxX, triangulation.x(v));
        minY = Math.min(minY, triangulation.y(v));
        maxY = Math.max(maxY, triangulation.y(v));
      }
      double padX = (maxX - minX) * EDGE_TOLERANCE;
      double padY = (maxY - minY) * EDGE_TOLERANCE;
      bounds[t] = new double[] {minX - padX, maxX + padX, minY - padY, maxY + padY};
    }
  }

  public static LinearSurface fit(double[] xs, double[] ys, double[] values) {
    if (values.length != xs.length) {
      throw new IllegalArgumentException("one value is required per sample");
    }
    return new LinearSurface(Triangulation.of(xs, ys), values.clone());
  }

  public boolean isEmpty() {
    return triangulation.isEmpty();
  }

  public int triangleCount() {
    return triangulation.size();
  }

  public OptionalDouble valueAt(double x, double y) {
    for (int t = 0; t < triangulation.size(); t++) {
      double[] box = bounds[t];
      if (x < box[0] || x > box[1] || y < box[2] || y > box[3]) {
        continue;
      }
      int[] tri = triangulation.triangle(t);
      double ax = triangulation.x(tri[0]);
      double ay = triangulation.y(tri[0]);
      double bx = triangulation.x(tri[1]);
      double by = triangulation.y(tri[1]);
      double cx = triangulation.x(tri[2]);
      double cy = triangulation.y(tri[2]);

      double area = Triangulation.signedArea(ax, ay, bx, by, cx, cy);
      if (!(area > 0)) {
        continue;
      }
      double wa = Triangulation.signedArea(x, y, bx, by, cx, cy) / area;
      double wb = Triangulation.signedArea(ax, ay, x, y, cx, cy) / area;
      double wc = Triangulation.signedArea(ax, ay, bx, by, x, y) / area;
      if (wa < -EDGE_TOLERANCE || wb < -EDGE_TOLERANCE || wc < -EDGE_TOLERANCE) {
        continue;
      }
      return OptionalDouble.of(MathArrays.linearCombination(
          wa, values[tri[0]], wb, values[tri[1]], wc, values[tri[2]]));
    }
    return OptionalDouble.empty();
  }
}
