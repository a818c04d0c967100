package ca.gc.cra.snare.infrastructure.protocol.http;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Method, path, and headers extracted from a captured HTTP request.
 *
 * <p>Parsing is lenient: a request line with an unrecognized verb yields method {@code UNKNOWN}, a missing path
 * yields {@code /}, and any later line containing a colon is treated as a header (last value wins).</p>
 *
 * @param method request verb or {@code UNKNOWN}
 * @param path request target or {@code /}
 * @param headers header names to values in arrival order
 * @since 0.1.0
 */
public record HttpRequestSummary(String method, String path, Map<String, String> headers) {
  static final String UNKNOWN_METHOD = "UNKNOWN";
  static final Set<String> METHODS =
      Set.of("GET", "POST", "PUT", "DELETE", "HEAD", "OPTIONS", "PATCH", "TRACE", "CONNECT");

  private static final JsonFactory JSON = new JsonFactory();

  public HttpRequestSummary {
    method = Objects.requireNonNull(method, "method");
    path = Objects.requireNonNull(path, "path");
    headers = headers == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
  }

  /**
   * Parses raw request text.
   *
   * @param raw decoded request bytes; may be {@code null}
   * @return summary, or {@code null} when the request has no lines at all
   */
  public static HttpRequestSummary parse(String raw) {
    if (raw == null) {
      return null;
    }
    List<String> lines = raw.lines().toList();
    if (lines.isEmpty()) {
      return null;
    }
    String[] parts = lines.get(0).trim().split("\\s+");
    String method = parts[0].isEmpty() || !METHODS.contains(parts[0]) ? UNKNOWN_METHOD : parts[0];
    String path = parts.length > 1 ? parts[1] : "/";
    Map<String, String> headers = new LinkedHashMap<>();
    for (String line : lines.subList(1, lines.size())) {
      int colon = line.indexOf(':');
      if (colon >= 0) {
        headers.put(line.substring(0, colon).trim(), line.substring(colon + 1).trim());
      }
    }
    return new HttpRequestSummary(method, path, headers);
  }

  /**
   * Renders the capture payload: {@code method=<m> path=<p> headers=<json object>}.
   *
   * @return payload text
   */
  public String toPayload() {
    return "method=" + method + " path=" + path + " headers=" + headersJson();
  }

  String headersJson() {
    StringWriter out = new StringWriter(64 + headers.size() * 32);
    try (JsonGenerator gen = JSON.createGenerator(out)) {
      gen.writeStartObject();
      for (Map.Entry<String, String> header : headers.entrySet()) {
        gen.writeStringField(header.getKey(), header.getValue());
      }
      gen.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("failed to render headers", ex);
    }
    return out.toString();
  }
}
