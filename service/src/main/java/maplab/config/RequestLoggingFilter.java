package maplab.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * One access line per request. Uploads also log their declared size and content type, since a
 * slow parse is usually a large map.
 */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);

  @Override
  protected void doFilterInternal(@NonNull HttpServletRequest request,
      @NonNull HttpServletResponse response, @NonNull FilterChain filterChain)
      throws ServletException, IOException {
    long startTime = System.currentTimeMillis();
    try {
      filterChain.doFilter(request, response);
    } catch (ServletException | IOException | RuntimeException ex) {
      log.error("Request {} failed: {}", RequestDescriptions.describe(request), ex.getMessage(), ex);
      throw ex;
    } finally {
      long duration = System.currentTimeMillis() - startTime;
      long contentLength = request.getContentLengthLong();
      if (contentLength > 0) {
        log.info("HTTP {} -> {} ({} ms, {} bytes {})",
            RequestDescriptions.describe(request),
            response.getStatus(),
            duration,
            contentLength,
            request.getContentType());
      } else {
        log.info("HTTP {} -> {} ({} ms)",
            RequestDescriptions.describe(request),
            response.getStatus(),
            duration);
      }
    }
  }
}
