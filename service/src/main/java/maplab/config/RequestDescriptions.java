package maplab.config;

import jakarta.servlet.http.HttpServletRequest;

/** How requests are named in log lines: method, path with query, originating client. */
final class RequestDescriptions {

  private RequestDescriptions() {
  }

  static String describe(HttpServletRequest request) {
    return request.getMethod() + " " + uriWithQuery(request) + " from " + clientIp(request);
  }

  static String uriWithQuery(HttpServletRequest request) {
    String queryString = request.getQueryString();
    if (queryString == null || queryString.isBlank()) {
      return request.getRequestURI();
    }
    return request.getRequestURI() + "?" + queryString;
  }

  static String clientIp(HttpServletRequest request) {
    String forwardedHeader = request.getHeader("X-Forwarded-For");
    if (forwardedHeader != null && !forwardedHeader.isBlank()) {
      return forwardedHeader.split(",")[0].trim();
    }
    return request.getRemoteAddr();
  }
}
