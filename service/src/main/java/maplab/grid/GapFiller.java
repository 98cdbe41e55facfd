package maplab.grid;

import java.util.OptionalDouble;
import java.util.function.DoubleUnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fills every gap of a sparse grid in two phases. The first fits a piecewise-linear surface over
 * the known cells; the second evaluates it at each gap and, where a gap lies outside the convex
 * hull of the known cells, takes the nearest known value instead.
 */
public final class GapFiller {
  private static final Logger log = LoggerFactory.getLogger(GapFiller.class);

  static final int MIN_KNOWN_POINTS = 3;

  private GapFiller() {
  }

  public record Result(MapGrid grid, int interpolated, int nearest) {}

  public static Result fill(SparseGrid grid, boolean rescale) {
    double[][] values = grid.copyValues();
    int gaps = grid.gapCount();
    if (gaps == 0) {
      return new Result(new MapGrid(grid.aAxis(), grid.bAxis(), values), 0, 0);
    }

    int known = grid.knownCount();
    if (known < MIN_KNOWN_POINTS) {
      throw new InsufficientDataException(known);
    }

    DoubleUnaryOperator scaleA = rescale ? unitScale(grid.aAxis()) : DoubleUnaryOperator.identity();
    DoubleUnaryOperator scaleB = rescale ? unitScale(grid.bAxis()) : DoubleUnaryOperator.identity();

    // known cells in row-major order, which also fixes nearest-neighbour tie-breaking
    double[] xs = new double[known];
    double[] ys = new double[known];
    double[] zs = new double[known];
    int k = 0;
    for (int i = 0; i < grid.rows(); i++) {
      for (int j = 0; j < grid.cols(); j++) {
        if (!grid.isGap(i, j)) {
          xs[k] = scaleA.applyAsDouble(grid.aAxis().get(j));
          ys[k] = scaleB.applyAsDouble(grid.bAxis().get(i));
          zs[k] = grid.value(i, j);
          k++;
        }
      }
    }

    LinearSurface surface = LinearSurface.fit(xs, ys, zs);
    NearestNeighbor nearest = new NearestNeighbor(xs, ys, zs);
    log.debug("Fitted {} triangles over {} known cells for {} gaps",
        surface.triangleCount(), known, gaps);

    int interpolated = 0;
    int extrapolated = 0;
    for (int i = 0; i < grid.rows(); i++) {
      for (int j = 0; j < grid.cols(); j++) {
        if (!grid.isGap(i, j)) {
          continue;
        }
        double x = scaleA.applyAsDouble(grid.aAxis().get(j));
        double y = scaleB.applyAsDouble(grid.bAxis().get(i));
        OptionalDouble estimate = surface.valueAt(x, y);
        if (estimate.isPresent()) {
          values[i][j] = estimate.getAsDouble();
          interpolated++;
        } else {
          values[i][j] = nearest.valueAt(x, y);
          extrapolated++;
        }
      }
    }

    int remaining = 0;
    for (double[] row : values) {
      for (double v : row) {
        if (!Double.isFinite(v)) {
          remaining++;
        }
      }
    }
    if (remaining > 0) {
      throw new UnfillableGridException(remaining);
    }
    return new Result(new MapGrid(grid.aAxis(), grid.bAxis(), values), interpolated, extrapolated);
  }

  private static DoubleUnaryOperator unitScale(Axis axis) {
    double min = axis.min();
    double span = axis.max() - min;
    if (span == 0d) {
      return v -> v - min;
    }
    return v -> (v - min) / span;
  }
}
