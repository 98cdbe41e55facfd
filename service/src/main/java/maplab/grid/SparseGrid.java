package maplab.grid;

/**
 * Pivoted values laid over the axis mesh. A cell is either known or a gap; gaps are held as NaN
 * and never leave the transform.
 */
public final class SparseGrid {
  private final Axis aAxis;
  private final Axis bAxis;
  private final double[][] values;

  SparseGrid(Axis aAxis, Axis bAxis, double[][] values) {
    if (values.length != bAxis.size()) {
      throw new IllegalArgumentException("row count must match B axis");
    }
    for (double[] row : values) {
      if (row.length != aAxis.size()) {
        throw new IllegalArgumentException("column count must match A axis");
      }
    }
    this.aAxis = aAxis;
    this.bAxis = bAxis;
    this.values = values;
  }

  public Axis aAxis() {
    return aAxis;
  }

  public Axis bAxis() {
    return bAxis;
  }

  public int rows() {
    return bAxis.size();
  }

  public int cols() {
    return aAxis.size();
  }

  public boolean isGap(int row, int col) {
    return Double.isNaN(values[row][col]);
  }

  public double value(int row, int col) {
    return values[row][col];
  }

  public int gapCount() {
    int gaps = 0;
    for (double[] row : values) {
      for (double v : row) {
        if (Double.isNaN(v)) {
          gaps++;
        }
      }
    }
    return gaps;
  }

  public int knownCount() {
    return rows() * cols() - gapCount();
  }

  double[][] copyValues() {
    double[][] copy = new double[values.length][];
    for (int i = 0; i < values.length; i++) {
      copy[i] = values[i].clone();
    }
    return copy;
  }
}
