package maplab.grid;

/** Mean C over every record sharing the same (A, B) coordinate. */
public record AggregatedPoint(double a, double b, double c, int samples) {}
