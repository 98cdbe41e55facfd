package maplab.grid;

/**
 * Dense result of the transform: X and Y are the coordinate mesh of the two axes and Z holds a
 * value for every cell. All three matrices have shape (|B axis|, |A axis|).
 */
public final class MapGrid {
  private final Axis aAxis;
  private final Axis bAxis;
  private final double[][] z;

  MapGrid(Axis aAxis, Axis bAxis, double[][] z) {
    if (z.length != bAxis.size()) {
      throw new IllegalArgumentException("row count must match B axis");
    }
    for (int i = 0; i < z.length; i++) {
      if (z[i].length != aAxis.size()) {
        throw new IllegalArgumentException("column count must match A axis");
      }
      for (int j = 0; j < z[i].length; j++) {
        if (Double.isNaN(z[i][j])) {
          throw new IllegalArgumentException("grid has a gap at [" + i + "," + j + "]");
        }
      }
    }
    this.aAxis = aAxis;
    this.bAxis = bAxis;
    this.z = z;
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

  public double value(int row, int col) {
    return z[row][col];
  }

  public double[][] x() {
    double[][] x = new double[rows()][cols()];
    for (int i = 0; i < rows(); i++) {
      for (int j = 0; j < cols(); j++) {
        x[i][j] = aAxis.get(j);
      }
    }
    return x;
  }

  public double[][] y() {
    double[][] y = new double[rows()][cols()];
    for (int i = 0; i < rows(); i++) {
      for (int j = 0; j < cols(); j++) {
        y[i][j] = bAxis.get(i);
      }
    }
    return y;
  }

  public double[][] z() {
    double[][] copy = new double[z.length][];
    for (int i = 0; i < z.length; i++) {
      copy[i] = z[i].clone();
    }
    return copy;
  }

  /** Z in row-major order: every A value of the first B row, then the next row. */
  public double[] flatten() {
    double[] flat = new double[rows() * cols()];
    for (int i = 0; i < rows(); i++) {
      System.arraycopy(z[i], 0, flat, i * cols(), cols());
    }
    return flat;
  }
}
