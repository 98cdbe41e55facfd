package maplab.grid;

import org.apache.commons.math3.ml.distance.EuclideanDistance;

/**
 * Value of the closest sample by Euclidean distance. On equal distances the sample that comes
 * first wins, so callers control tie-breaking through the order they pass samples in.
 */
public final class NearestNeighbor {
  private final EuclideanDistance distance = new EuclideanDistance();
  private final double[][] samples;
  private final double[] values;

  public NearestNeighbor(double[] xs, double[] ys, double[] values) {
    if (xs.length == 0 || xs.length != ys.length || xs.length != values.length) {
      throw new IllegalArgumentException("at least one sample with x, y and value is required");
    }
    this.samples = new double[xs.length][];
    for (int i = 0; i < xs.length; i++) {
      samples[i] = new double[] {xs[i], ys[i]};
    }
    this.values = values.clone();
  }

  public int nearestIndex(double x, double y) {
    double[] query = {x, y};
    int best = 0;
    double bestDistance = distance.compute(query, samples[0]);
    for (int i = 1; i < samples.length; i++) {
      double d = distance.compute(query, samples[i]);
      if (d < bestDistance) {
        best = i;
        bestDistance = d;
      }
    }
    return best;
  }

  public double valueAt(double x, double y) {
    return values[nearestIndex(x, y)];
  }
}
