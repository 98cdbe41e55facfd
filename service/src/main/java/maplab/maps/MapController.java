package maplab.maps;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import maplab.config.MapLabProperties;
import maplab.grid.ColumnLabels;
import maplab.grid.MapFileNotFoundException;
import maplab.grid.MapGrid;
import maplab.grid.MapParseService;
import maplab.grid.ParsedMap;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MimeTypeUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/api/maps")
@Tag(name = "Maps")
public class MapController {
  private static final MediaType CSV_MEDIA_TYPE = CsvHttpMessageConverter.TEXT_CSV;
  private static final String ERROR_DOCS_BASE = "https://docs.maplab.dev/errors/";

  private final MapParseService parser;
  private final MapUploadStager stager;
  private final MapLabProperties.LocalFiles localFiles;

  public MapController(MapParseService parser, MapUploadStager stager,
      MapLabProperties properties) {
    this.parser = parser;
    this.stager = stager;
    this.localFiles = properties.api().localFiles();
  }

  @PostMapping("/parse")
  @Operation(summary = "Parse a map file",
      description = "Parse an uploaded map table, or a file already on the server, into a dense "
          + "grid. Duplicate points are averaged and missing cells are interpolated.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Dense map grid",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = ParsedMapResponse.class)),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Invalid request or unparseable map",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "404", description = "Map file not found",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "413", description = "Upload too large",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<?> parse(
      @RequestParam(name = "file_path", required = false)
          @Parameter(description = "Path of a map file on the server", example = "sample_data/stock_map.csv")
          String filePath,
      @RequestParam(name = "file", required = false)
          @Parameter(description = "Uploaded map file") MultipartFile file,
      @RequestParam(name = "format", required = false)
          @Parameter(description = "Response format, json or csv", example = "json") String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    MediaType contentType = selectMediaType(format, accept);
    if (StringUtils.hasText(filePath)) {
      return respond(parser.parse(resolveLocalFile(filePath)), contentType);
    }
    if (file == null) {
      throw invalidParameter("file",
          "Either 'file_path' query parameter or 'file' upload required", 2001);
    }
    Path staged = stager.stage(file);
    try {
      return respond(parser.parse(staged), contentType);
    } finally {
      stager.discard(staged);
    }
  }

  @GetMapping("/parse")
  @Operation(summary = "Parse a server-side map file",
      description = "Parse a map file that already lives on the server into a dense grid.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Dense map grid",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = ParsedMapResponse.class)),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Invalid request or unparseable map",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "404", description = "Map file not found",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<?> parseLocal(
      @RequestParam(name = "file_path")
          @Parameter(description = "Path of a map file on the server", example = "sample_data/stock_map.csv")
          String filePath,
      @RequestParam(name = "format", required = false)
          @Parameter(description = "Response format, json or csv", example = "json") String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    MediaType contentType = selectMediaType(format, accept);
    return respond(parser.parse(resolveLocalFile(filePath)), contentType);
  }

  private ResponseEntity<?> respond(ParsedMap parsed, MediaType contentType) {
    ColumnLabels labels = parser.labels();
    Object body = contentType.isCompatibleWith(CSV_MEDIA_TYPE)
        ? cellRows(parsed.grid(), labels)
        : ParsedMapResponse.from(parsed, labels);
    return ResponseEntity.ok().contentType(contentType).body(body);
  }

  // one row per cell, row-major, named after the configured columns
  static List<Map<String, Object>> cellRows(MapGrid grid, ColumnLabels labels) {
    List<Map<String, Object>> rows = new ArrayList<>(grid.rows() * grid.cols());
    for (int i = 0; i < grid.rows(); i++) {
      for (int j = 0; j < grid.cols(); j++) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(labels.a(), grid.aAxis().get(j));
        row.put(labels.b(), grid.bAxis().get(i));
        row.put(labels.c(), grid.value(i, j));
        rows.add(row);
      }
    }
    return rows;
  }

  private Path resolveLocalFile(String filePath) {
    if (!localFiles.enabled()) {
      throw invalidParameter("file_path", "Reading server-side files is disabled", 2002);
    }
    Path resolved = Path.of(filePath).toAbsolutePath().normalize();
    if (StringUtils.hasText(localFiles.root())) {
      Path root = Path.of(localFiles.root()).toAbsolutePath().normalize();
      if (!resolved.startsWith(root) || linksOutside(resolved, root)) {
        throw invalidParameter("file_path",
            "File path must be inside the configured map directory", 2003);
      }
    }
    if (!Files.exists(resolved)) {
      throw new MapFileNotFoundException(Path.of(filePath));
    }
    return resolved;
  }

  // symlinks are followed, so a link under the root may still point elsewhere
  private static boolean linksOutside(Path resolved, Path root) {
    if (!Files.exists(resolved)) {
      return false;
    }
    try {
      return !resolved.toRealPath().startsWith(root.toRealPath());
    } catch (IOException ex) {
      throw new UncheckedIOException("Cannot resolve file path " + resolved, ex);
    }
  }

  private static MediaType selectMediaType(String format, String accept) {
    if (StringUtils.hasText(format)) {
      if ("csv".equalsIgnoreCase(format)) {
        return CSV_MEDIA_TYPE;
      }
      if ("json".equalsIgnoreCase(format)) {
        return MediaType.APPLICATION_JSON;
      }
      throw invalidParameter("format", "Invalid format value. Supported values: json,csv.", 2004);
    }
    if (!StringUtils.hasText(accept)) {
      return MediaType.APPLICATION_JSON;
    }
    List<MediaType> mediaTypes = MediaType.parseMediaTypes(accept);
    mediaTypes.sort(Comparator.comparingDouble(MediaType::getQualityValue).reversed());
    MimeTypeUtils.sortBySpecificity(mediaTypes);
    for (MediaType mediaType : mediaTypes) {
      if (mediaType.isCompatibleWith(MediaType.APPLICATION_JSON)) {
        return MediaType.APPLICATION_JSON;
      }
      if (mediaType.isCompatibleWith(CSV_MEDIA_TYPE)) {
        return CSV_MEDIA_TYPE;
      }
    }
    return MediaType.APPLICATION_JSON;
  }

  private static InvalidParameterException invalidParameter(String parameter, String message,
      int errorCode) {
    return new InvalidParameterException(parameter, message, errorCode,
        ERROR_DOCS_BASE + errorCode);
  }
}
