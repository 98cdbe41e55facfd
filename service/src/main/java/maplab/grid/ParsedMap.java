package maplab.grid;

public record ParsedMap(MapGrid grid, ParseReport report) {}
