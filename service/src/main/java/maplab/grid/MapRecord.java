package maplab.grid;

// One coerced row: all three fields are finite
public record MapRecord(double a, double b, double c) {}
