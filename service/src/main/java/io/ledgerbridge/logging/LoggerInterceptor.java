package io.ledgerbridge.logging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

@Component
@Slf4j
public record LoggerInterceptor(ObjectMapper mapper) implements HandlerInterceptor {

  // the callback carries the authorization code and state as query parameters
  private static final Set<String> REDACTED_PARAMS = Set.of("code", "state");

  private static final String REQUEST_START_ATTRIBUTE = "x-request-start";
  private static final long NOT_FOUND_DURATION = -1;

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    request.setAttribute(REQUEST_START_ATTRIBUTE, System.currentTimeMillis());
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
    long requestDuration;
    var requestStartTime = (Long) request.getAttribute(REQUEST_START_ATTRIBUTE);
    if (requestStartTime != null) {
      requestDuration = System.currentTimeMillis() - requestStartTime;
    } else {
      requestDuration = NOT_FOUND_DURATION;
    }

    var message =
        String.format(
            "%s %s %d %dms params=%s",
            request.getMethod(),
            request.getRequestURI(),
            response.getStatus(),
            requestDuration,
            paramString(request.getParameterMap()));
    if (response.getStatus() >= 400) {
      log.warn(message);
    } else {
      log.info(message);
    }

    if (ex != null) {
      log.error("An error occurred processing this request: ", ex);
    }
  }

  private String paramString(Map<String, String[]> paramMap) {
    var params = new TreeMap<String, Object>();
    paramMap.forEach(
        (name, values) -> params.put(name, REDACTED_PARAMS.contains(name) ? "***" : values));
    try {
      return mapper.writeValueAsString(params);
    } catch (JsonProcessingException e) {
      log.debug("Could not serialize request parameters", e);
      return params.keySet().toString();
    }
  }
}
