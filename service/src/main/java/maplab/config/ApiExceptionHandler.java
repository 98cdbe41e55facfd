package maplab.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import java.net.URI;
import java.util.HashMap;
import java.util.Map;
import maplab.grid.InsufficientDataException;
import maplab.grid.MapParseErrorKind;
import maplab.grid.MapParseException;
import maplab.grid.MissingColumnsException;
import maplab.grid.UnfillableGridException;
import maplab.maps.InvalidParameterException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  private static final String PROBLEM_TYPE_BASE = "https://docs.maplab.dev/problems/";

  private static final Map<HttpStatus, String> TYPE_SLUGS = Map.of(
      HttpStatus.BAD_REQUEST, "invalid-parameter",
      HttpStatus.UNAUTHORIZED, "unauthorized",
      HttpStatus.FORBIDDEN, "forbidden",
      HttpStatus.NOT_FOUND, "not-found",
      HttpStatus.METHOD_NOT_ALLOWED, "method-not-allowed",
      HttpStatus.PAYLOAD_TOO_LARGE, "payload-too-large",
      HttpStatus.UNSUPPORTED_MEDIA_TYPE, "unsupported-media-type",
      HttpStatus.INTERNAL_SERVER_ERROR, "internal-error"
  );

  @ExceptionHandler(MapParseException.class)
  public ResponseEntity<ProblemDetail> handleMapParse(MapParseException ex,
      HttpServletRequest request) {
    HttpStatus status = ex.kind() == MapParseErrorKind.NOT_FOUND
        ? HttpStatus.NOT_FOUND
        : HttpStatus.BAD_REQUEST;
    ResponseEntity<ProblemDetail> response = buildProblem(status, ex, request,
        "Map parsing error: " + ex.getMessage(), ex.kind().slug());
    ProblemDetail detail = response.getBody();
    detail.setTitle("Map parsing error");
    detail.setProperty("kind", ex.kind().slug());
    if (ex instanceof MissingColumnsException missingColumns) {
      detail.setProperty("missing", missingColumns.missing());
      detail.setProperty("found", missingColumns.found());
    } else if (ex instanceof InsufficientDataException insufficient) {
      detail.setProperty("known_count", insufficient.knownCount());
    } else if (ex instanceof UnfillableGridException unfillable) {
      detail.setProperty("remaining_gaps", unfillable.remainingGaps());
    }
    return response;
  }

  @ExceptionHandler({ConstraintViolationException.class, MethodArgumentNotValidException.class,
      MethodArgumentTypeMismatchException.class, IllegalArgumentException.class})
  public ResponseEntity<ProblemDetail> handleBadRequest(Exception ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.BAD_REQUEST, ex, request);
  }

  @ExceptionHandler(InvalidParameterException.class)
  public ResponseEntity<Map<String, Object>> handleInvalidParameter(InvalidParameterException ex,
      HttpServletRequest request) {
    logException(HttpStatus.BAD_REQUEST, ex, request);
    Map<String, Object> body = new HashMap<>();
    body.put("error", ex.getMessage());
    body.put("parameter", ex.parameter());
    body.put("errorCode", ex.errorCode());
    body.put("moreInfo", ex.moreInfo());
    body.put("path", request.getRequestURI());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ProblemDetail> handleUploadTooLarge(MaxUploadSizeExceededException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.PAYLOAD_TOO_LARGE, ex, request,
        "Uploaded map exceeds the maximum allowed size", TYPE_SLUGS.get(HttpStatus.PAYLOAD_TOO_LARGE));
  }

  @ExceptionHandler(AuthenticationException.class)
  public ResponseEntity<ProblemDetail> handleUnauthorized(AuthenticationException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.UNAUTHORIZED, ex, request);
  }

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<ProblemDetail> handleForbidden(AccessDeniedException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.FORBIDDEN, ex, request);
  }

  @ExceptionHandler({ResponseStatusException.class, NoResourceFoundException.class,
      HttpRequestMethodNotSupportedException.class, HttpMediaTypeNotSupportedException.class,
      MissingServletRequestParameterException.class})
  public ResponseEntity<ProblemDetail> handleErrorResponse(Exception ex,
      HttpServletRequest request) {
    HttpStatus status = ex instanceof ErrorResponse errorResponse
        ? HttpStatus.resolve(errorResponse.getStatusCode().value())
        : null;
    if (status == null) {
      status = HttpStatus.INTERNAL_SERVER_ERROR;
    }
    return buildProblem(status, ex, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleServerError(Exception ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.INTERNAL_SERVER_ERROR, ex, request);
  }

  private ResponseEntity<ProblemDetail> buildProblem(HttpStatus status, Exception ex,
      HttpServletRequest request) {
    return buildProblem(status, ex, request, ex.getMessage(),
        TYPE_SLUGS.getOrDefault(status, "internal-error"));
  }

  private ResponseEntity<ProblemDetail> buildProblem(HttpStatus status, Exception ex,
      HttpServletRequest request, String message, String typeSlug) {
    logException(status, ex, request);
    ProblemDetail detail = ProblemDetail.forStatusAndDetail(status, message);
    detail.setTitle(status.getReasonPhrase());
    detail.setInstance(URI.create(request.getRequestURI()));
    detail.setType(URI.create(PROBLEM_TYPE_BASE + typeSlug));
    detail.setProperty("path", request.getRequestURI());
    return ResponseEntity.status(status).body(detail);
  }

  private void logException(HttpStatus status, Exception ex, HttpServletRequest request) {
    String errorMessage = ex.getMessage();
    if (errorMessage == null || errorMessage.isBlank()) {
      errorMessage = ex.getClass().getName();
    }

    if (status.is5xxServerError()) {
      log.error("Request {} failed with status {}: {}",
          RequestDescriptions.describe(request), status.value(), errorMessage, ex);
    } else if (status.is4xxClientError()) {
      log.warn("Request {} returned status {}: {}",
          RequestDescriptions.describe(request), status.value(), errorMessage);
    } else {
      log.info("Request {} resulted in status {}: {}",
          RequestDescriptions.describe(request), status.value(), errorMessage);
    }
  }
}
