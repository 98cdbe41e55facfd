package maplab.grid;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;
import org.apache.commons.math3.util.MathArrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delaunay triangulation of a set of distinct planar points.
 *
 * <p>Points are inserted in lexicographic (x, then y) order. Every new point lies outside the
 * hull built so far, so it is joined to each hull edge it can see; the union of the triangles
 * always covers the convex hull exactly. Lawson edge flips then replace every edge whose
 * opposite vertex falls strictly inside the neighbouring circumcircle.
 *
 * <p>Triangles are stored counter-clockwise as indices into the input arrays. Input whose points
 * are all collinear has no triangles.
 */
public final class Triangulation {
  private static final Logger log = LoggerFactory.getLogger(Triangulation.class);

  private static final double ORIENTATION_TOLERANCE = 1e-12;
  private static final double IN_CIRCLE_TOLERANCE = 1e-12;

  private final double[] xs;
  private final double[] ys;
  private final List<int[]> triangles;

  private Triangulation(double[] xs, double[] ys, List<int[]> triangles) {
    this.xs = xs;
    this.ys = ys;
    this.triangles = triangles;
  }

  public static Triangulation of(double[] xs, double[] ys) {
    if (xs.length != ys.length) {
      throw new IllegalArgumentException("coordinate arrays must have equal length");
    }
    double[] x = xs.clone();
    double[] y = ys.clone();
    List<int[]> triangles = sweep(x, y);
    if (!triangles.isEmpty()) {
      legalize(x, y, triangles);
    }
    return new Triangulation(x, y, triangles);
  }

  public int size() {
    return triangles.size();
  }

  public boolean isEmpty() {
    return triangles.isEmpty();
  }

  public int[] triangle(int index) {
    return triangles.get(index).clone();
  }

  public double x(int vertex) {
    return xs[vertex];
  }

  public double y(int vertex) {
    return ys[vertex];
  }

  private static List<int[]> sweep(double[] x, double[] y) {
    int n = x.length;
    List<int[]> triangles = new ArrayList<>();
    if (n < 3) {
      return triangles;
    }
    int[] order = IntStream.range(0, n).boxed()
        .sorted(Comparator.<Integer>comparingDouble(i -> x[i]).thenComparingDouble(i -> y[i]))
        .mapToInt(Integer::intValue)
        .toArray();

    // leading run of collinear points, closed by the first point off their line
    int k = 2;
    while (k < n && orientation(x, y, order[0], order[1], order[k]) == 0) {
      k++;
    }
    if (k == n) {
      return triangles;
    }
    int apex = order[k];
    boolean left = orientation(x, y, order[0], order[1], apex) > 0;
    List<Integer> hull = new ArrayList<>();
    for (int i = 0; i < k - 1; i++) {
      triangles.add(left
          ? new int[] {order[i], order[i + 1], apex}
          : new int[] {order[i + 1], order[i], apex});
    }
    if (left) {
      for (int i = 0; i < k; i++) {
        hull.add(order[i]);
      }
      hull.add(apex);
    } else {
      hull.add(order[0]);
      hull.add(apex);
      for (int i = k - 1; i >= 1; i--) {
        hull.add(order[i]);
      }
    }

    for (int m = k + 1; m < n; m++) {
      int p = order[m];
      hull = attach(x, y, hull, p, triangles);
    }
    return triangles;
  }

  private static List<Integer> attach(double[] x, double[] y, List<Integer> hull, int p,
      List<int[]> triangles) {
    int h = hull.size();
    boolean[] visible = new boolean[h];
    for (int i = 0; i < h; i++) {
      visible[i] = orientation(x, y, hull.get(i), hull.get((i + 1) % h), p) < 0;
    }
    int start = -1;
    for (int i = 0; i < h; i++) {
      if (visible[i] && !visible[(i - 1 + h) % h]) {
        start = i;
        break;
      }
    }
    if (start < 0) {
      log.debug("Point {} ({}, {}) sees no hull edge; left out of the triangulation",
          p, x[p], y[p]);
      return hull;
    }
    int end = start;
    while (visible[(end + 1) % h] && (end + 1) % h != start) {
      end = (end + 1) % h;
    }
    for (int j = start; ; j = (j + 1) % h) {
      triangles.add(new int[] {hull.get((j + 1) % h), hull.get(j), p});
      if (j == end) {
        break;
      }
    }

    List<Integer> next = new ArrayList<>(h + 1);
    for (int i = (end + 1) % h; ; i = (i + 1) % h) {
      next.add(hull.get(i));
      if (i == start) {
        break;
      }
    }
    next.add(p);
    return next;
  }

  private static void legalize(double[] x, double[] y, List<int[]> triangles) {
    Map<Long, Integer> edges = new HashMap<>();
    for (int t = 0; t < triangles.size(); t++) {
      register(edges, triangles.get(t), t);
    }
    Deque<Long> pending = new ArrayDeque<>();
    for (int[] tri : triangles) {
      for (int i = 0; i < 3; i++) {
        int u = tri[i];
        int v = tri[(i + 1) % 3];
        if (u < v && edges.containsKey(key(v, u))) {
          pending.push(key(u, v));
        }
      }
    }

    long budget = 8L * x.length * x.length + 64;
    while (!pending.isEmpty()) {
      if (budget-- == 0) {
        log.debug("Edge flip budget exhausted; keeping the current triangulation");
        return;
      }
      long edge = pending.pop();
      int u = (int) (edge >>> 32);
      int v = (int) edge;
      Integer t1 = edges.get(key(u, v));
      Integer t2 = edges.get(key(v, u));
      if (t1 == null || t2 == null) {
        continue;
      }
      int p = opposite(triangles.get(t1), u, v);
      int q = opposite(triangles.get(t2), v, u);
      if (!inCircle(x, y, u, v, p, q)) {
        continue;
      }
      unregister(edges, triangles.get(t1));
      unregister(edges, triangles.get(t2));
      int[] first = {p, u, q};
      int[] second = {q, v, p};
      triangles.set(t1, first);
      triangles.set(t2, second);
      register(edges, first, t1);
      register(edges, second, t2);
      pending.push(key(u, q));
      pending.push(key(q, v));
      pending.push(key(v, p));
      pending.push(key(p, u));
    }
  }

  private static void register(Map<Long, Integer> edges, int[] tri, int index) {
    for (int i = 0; i < 3; i++) {
      edges.put(key(tri[i], tri[(i + 1) % 3]), index);
    }
  }

  private static void unregister(Map<Long, Integer> edges, int[] tri) {
    for (int i = 0; i < 3; i++) {
      edges.remove(key(tri[i], tri[(i + 1) % 3]));
    }
  }

  private static int opposite(int[] tri, int u, int v) {
    for (int vertex : tri) {
      if (vertex != u && vertex != v) {
        return vertex;
      }
    }
    throw new IllegalStateException("triangle " + Arrays.toString(tri)
        + " has no vertex opposite edge " + u + "-" + v);
  }

  private static long key(int u, int v) {
    return ((long) u << 32) | (v & 0xffffffffL);
  }

  /** Twice the signed area of (a, b, c); positive when counter-clockwise. */
  static double signedArea(double ax, double ay, double bx, double by, double cx, double cy) {
    return MathArrays.linearCombination(bx - ax, cy - ay, -(by - ay), cx - ax);
  }

  static int orientation(double[] x, double[] y, int a, int b, int c) {
    double area = signedArea(x[a], y[a], x[b], y[b], x[c], y[c]);
    double scale = Math.abs((x[b] - x[a]) * (y[c] - y[a])) + Math.abs((y[b] - y[a]) * (x[c] - x[a]));
    if (Math.abs(area) <= ORIENTATION_TOLERANCE * scale) {
      return 0;
    }
    return area > 0 ? 1 : -1;
  }

  // d strictly inside the circumcircle of the counter-clockwise triangle (a, b, c)
  static boolean inCircle(double[] x, double[] y, int a, int b, int c, int d) {
    double adx = x[a] - x[d];
    double ady = y[a] - y[d];
    double bdx = x[b] - x[d];
    double bdy = y[b] - y[d];
    double cdx = x[c] - x[d];
    double cdy = y[c] - y[d];
    double alift = adx * adx + ady * ady;
    double blift = bdx * bdx + bdy * bdy;
    double clift = cdx * cdx + cdy * cdy;

    double det = MathArrays.linearCombination(
        adx, MathArrays.linearCombination(bdy, clift, -cdy, blift),
        -ady, MathArrays.linearCombination(bdx, clift, -cdx, blift),
        alift, MathArrays.linearCombination(bdx, cdy, -cdx, bdy));
    double scale = (alift + blift + clift) * (alift + blift + clift);
    return det > IN_CIRCLE_TOLERANCE * scale;
  }
}
