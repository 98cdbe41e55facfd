package maplab.grid;

import java.util.Arrays;

/**
 * Strictly ascending sequence of distinct finite coordinates along one grid dimension.
 */
public final class Axis {
  private final double[] values;

  private Axis(double[] values) {
    this.values = values;
  }

  public static Axis of(double... values) {
    double[] copy = values.clone();
    for (int i = 0; i < copy.length; i++) {
      if (!Double.isFinite(copy[i])) {
        throw new IllegalArgumentException("axis value at " + i + " is not finite");
      }
      if (i > 0 && !(copy[i] > copy[i - 1])) {
        throw new IllegalArgumentException("axis must be strictly ascending at index " + i);
      }
    }
    return new Axis(copy);
  }

  public static Axis fromUnsorted(double[] values) {
    double[] sorted = Arrays.stream(values).distinct().sorted().toArray();
    return of(sorted);
  }

  public int size() {
    return values.length;
  }

  public double get(int index) {
    return values[index];
  }

  public int indexOf(double value) {
    int index = Arrays.binarySearch(values, value);
    if (index < 0) {
      throw new IllegalArgumentException("value " + value + " is not on the axis");
    }
    return index;
  }

  public double min() {
    return values[0];
  }

  public double max() {
    return values[values.length - 1];
  }

  public double[] toArray() {
    return values.clone();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Axis other && Arrays.equals(values, other.values);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(values);
  }

  @Override
  public String toString() {
    return Arrays.toString(values);
  }
}
