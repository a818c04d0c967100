package ca.gc.cra.snare.domain.util;

/**
 * HTML entity escaping for captured payloads.
 *
 * <p>Attack payloads are rendered by dashboards downstream; escaping at capture time means no stored row can
 * carry live markup.</p>
 *
 * @since 0.1.0
 */
public final class Html {
  private Html() {}

  /**
   * Replaces {@code & < > " '} with their entity forms.
   *
   * @param text raw text; {@code null} yields an empty string
   * @return escaped text
   */
  public static String escape(String text) {
    if (text == null || text.isEmpty()) {
      return "";
    }
    StringBuilder out = null;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      String replacement = switch (c) {
        case '&' -> "&amp;";
        case '<' -> "&lt;";
        case '>' -> "&gt;";
        case '"' -> "&quot;";
        case '\'' -> "&#x27;";
        default -> null;
      };
      if (replacement == null) {
        if (out != null) {
          out.append(c);
        }
        continue;
      }
      if (out == null) {
        out = new StringBuilder(text.length() + 16);
        out.append(text, 0, i);
      }
      out.append(replacement);
    }
    return out == null ? text : out.toString();
  }
}
