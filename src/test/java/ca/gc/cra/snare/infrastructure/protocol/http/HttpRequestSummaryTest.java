package ca.gc.cra.snare.infrastructure.protocol.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.util.Map;
import org.junit.jupiter.api.Test;

class HttpRequestSummaryTest {

  @Test
  void parsesRequestLineAndHeaders() {
    HttpRequestSummary summary =
        HttpRequestSummary.parse("POST /cgi-bin/luci HTTP/1.1\r\nHost: a\r\nX-Forwarded-For: 1.2.3.4\r\n\r\nbody");

    assertEquals("POST", summary.method());
    assertEquals("/cgi-bin/luci", summary.path());
    assertEquals(Map.of("Host", "a", "X-Forwarded-For", "1.2.3.4"), summary.headers());
  }

  @Test
  void unknownMethodAndMissingPathAreNormalized() {
    HttpRequestSummary summary = HttpRequestSummary.parse("\u0016\u0003\u0001garbage");

    assertEquals(HttpRequestSummary.UNKNOWN_METHOD, summary.method());
    assertEquals("/", summary.path());
  }

  @Test
  void headerValuesAreJsonEscaped() {
    HttpRequestSummary summary = HttpRequestSummary.parse("GET / HTTP/1.0\r\nUser-Agent: \"quoted\" \\ agent\r\n");

    assertEquals("{\"User-Agent\":\"\\\"quoted\\\" \\\\ agent\"}", summary.headersJson());
  }

  @Test
  void payloadWithoutHeadersRendersEmptyObject() {
    assertEquals("method=GET path=/ headers={}", HttpRequestSummary.parse("GET / HTTP/1.0").toPayload());
  }

  @Test
  void emptyInputHasNoSummary() {
    assertNull(HttpRequestSummary.parse(""));
    assertNull(HttpRequestSummary.parse(null));
  }
}
