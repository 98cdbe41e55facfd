package maplab.grid;

import java.util.Arrays;
import java.util.List;

/** Pivots aggregated points onto the mesh of their distinct A and B values. */
public final class GridBuilder {
  private GridBuilder() {
  }

  public static SparseGrid build(List<AggregatedPoint> points) {
    if (points.isEmpty()) {
      throw new IllegalArgumentException("at least one point is required to build a grid");
    }
    Axis aAxis = Axis.fromUnsorted(points.stream().mapToDouble(AggregatedPoint::a).toArray());
    Axis bAxis = Axis.fromUnsorted(points.stream().mapToDouble(AggregatedPoint::b).toArray());

    double[][] values = new double[bAxis.size()][aAxis.size()];
    for (double[] row : values) {
      Arrays.fill(row, Double.NaN);
    }
    for (AggregatedPoint p : points) {
      int row = bAxis.indexOf(p.b());
      int col = aAxis.indexOf(p.a());
      if (!Double.isNaN(values[row][col])) {
        throw new IllegalArgumentException("duplicate point at (" + p.a() + ", " + p.b() + ")");
      }
      values[row][col] = p.c();
    }
    return new SparseGrid(aAxis, bAxis, values);
  }
}
