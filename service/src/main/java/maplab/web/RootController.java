package maplab.web;

import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RootController {

  private final String version;

  public RootController(@Value("${maplab.api.version:v1}") String version) {
    this.version = version;
  }

  @GetMapping("/")
  public Map<String, Object> root() {
    return Map.of(
        "service", "maplab-service",
        "message", "ECU Map Lab API",
        "version", version,
        "status", "ok",
        "parse", "/api/maps/parse");
  }

  @GetMapping("/v1/ping")
  public ResponseEntity<Map<String, Object>> ping() {
    return ResponseEntity.ok(Map.of("pong", true));
  }
}
