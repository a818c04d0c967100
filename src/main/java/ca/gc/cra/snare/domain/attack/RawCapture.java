package ca.gc.cra.snare.domain.attack;

import java.util.Objects;

/**
 * Result of one scripted exchange: the handler's classification tag and the unsanitized text it captured.
 *
 * @param attackType classification tag chosen by the handler; never {@code null}
 * @param payload captured text; never {@code null}, possibly empty
 * @since 0.1.0
 */
public record RawCapture(AttackType attackType, String payload) {

  public RawCapture {
    attackType = Objects.requireNonNull(attackType, "attackType");
    payload = payload == null ? "" : payload;
  }
}
