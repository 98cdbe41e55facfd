package maplab.grid;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.stat.StatUtils;

/**
 * Collapses records that share an (A, B) coordinate into one point carrying the mean of their C
 * values. Coordinates are compared with exact floating-point equality unless a decimal scale is
 * given, in which case both are rounded half-up to that many places first.
 */
public final class Aggregator {
  private static final Comparator<AggregatedPoint> ROW_MAJOR =
      Comparator.comparingDouble(AggregatedPoint::b).thenComparingDouble(AggregatedPoint::a);

  private Aggregator() {
  }

  private record Key(double a, double b) {}

  public static List<AggregatedPoint> aggregate(List<MapRecord> records, Integer coordinateScale) {
    Map<Key, List<Double>> groups = new HashMap<>();
    for (MapRecord r : records) {
      Key key = new Key(canonical(r.a(), coordinateScale), canonical(r.b(), coordinateScale));
      groups.computeIfAbsent(key, k -> new ArrayList<>()).add(r.c());
    }

    List<AggregatedPoint> points = new ArrayList<>(groups.size());
    for (var e : groups.entrySet()) {
      double[] values = e.getValue().stream().mapToDouble(Double::doubleValue).toArray();
      // summing in sorted order keeps the mean independent of row order
      Arrays.sort(values);
      Key key = e.getKey();
      points.add(new AggregatedPoint(key.a(), key.b(), mean(values), values.length));
    }
    points.sort(ROW_MAJOR);
    return points;
  }

  // a sum of large finite values can overflow even when their mean is representable
  static double mean(double[] values) {
    double mean = StatUtils.mean(values);
    if (Double.isFinite(mean)) {
      return mean;
    }
    double scaled = 0d;
    for (double v : values) {
      scaled += v / values.length;
    }
    return scaled;
  }

  static double canonical(double value, Integer scale) {
    double v = value;
    if (scale != null) {
      v = BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
    // -0.0 and 0.0 compare equal as numbers but not as record components
    return v == 0d ? 0d : v;
  }
}
