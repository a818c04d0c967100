package ca.gc.cra.snare.application.analysis;

import ca.gc.cra.snare.domain.attack.AttackPattern;
import ca.gc.cra.snare.domain.attack.AttackType;
import ca.gc.cra.snare.domain.attack.CapturedAttack;
import ca.gc.cra.snare.domain.attack.SourceCount;
import ca.gc.cra.snare.domain.attack.ThreatAssessment;
import ca.gc.cra.snare.domain.attack.ThreatLevel;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * <strong>What:</strong> Classifies captured attacks from cumulative per-source history.
 * <p><strong>Why:</strong> Severity tracks how often a source has hit any decoy, so repeat offenders escalate
 * from MEDIUM to CRITICAL regardless of which protocol they probe.</p>
 * <p><strong>Thread-safety:</strong> All counters are guarded by one lock; concurrent {@link #analyze} calls
 * from different handlers observe a consistent, strictly increasing history per source.</p>
 * <p><strong>Lifecycle:</strong> One instance per process, injected by the composition root. Counters only grow;
 * {@link #reset()} exists for test isolation.</p>
 *
 * @since 0.1.0
 */
public class ThreatAnalyzer {
  static final int MEDIUM_THRESHOLD = 3;
  static final int HIGH_THRESHOLD = 10;
  static final int CRITICAL_THRESHOLD = 25;
  static final int TOP_SOURCES = 10;

  static final String UNKNOWN_SOURCE = "unknown";

  static final String BLOCK_IP = "Block IP %s immediately at the firewall level.";
  static final String ENABLE_LOCKOUT = "Enable account lockout policies and consider fail2ban.";
  static final String KEY_BASED_LOGIN = "Disable password authentication and enforce SSH key-based login.";
  static final String REVIEW_ENDPOINTS = "Review exposed HTTP endpoints and remove unnecessary server banners.";
  static final String ENABLE_WAF = "Enable a Web Application Firewall (WAF).";
  static final String INVESTIGATE = "Investigate the source IP and review related logs.";
  static final String ESCALATE = "Escalate to the incident response team.";

  private final ReentrantLock lock = new ReentrantLock();
  private final Map<String, Long> countsBySource = new LinkedHashMap<>();
  private final Map<AttackType, Long> countsByType = new EnumMap<>(AttackType.class);
  private final Map<ThreatLevel, Long> countsByLevel = new EnumMap<>(ThreatLevel.class);

  /**
   * Classifies one capture and records it in the cumulative counters.
   *
   * @param attack captured attack; a {@code null} attack is not accepted
   * @return threat level, pattern, and ordered recommendations
   */
  public ThreatAssessment analyze(CapturedAttack attack) {
    String sourceIp = sourceKey(attack.sourceIp());
    AttackType type = attack.attackType() == null ? AttackType.UNKNOWN : attack.attackType();
    lock.lock();
    try {
      long history = countsBySource.merge(sourceIp, 1L, Long::sum);
      countsByType.merge(type, 1L, Long::sum);

      ThreatLevel level = levelFor(history, type);
      AttackPattern pattern = patternFor(type);
      List<String> recommendations = recommendationsFor(sourceIp, level, pattern);

      countsByLevel.merge(level, 1L, Long::sum);
      return new ThreatAssessment(level, pattern, recommendations);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the number of attacks recorded for a source.
   *
   * @param sourceIp remote address text; blank maps to {@code unknown}
   * @return cumulative count, {@code 0} when never seen
   */
  public long attackHistory(String sourceIp) {
    String key = sourceKey(sourceIp);
    lock.lock();
    try {
      return countsBySource.getOrDefault(key, 0L);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Snapshots the counters.
   *
   * @return immutable statistics copy
   */
  public ThreatStatistics statistics() {
    lock.lock();
    try {
      List<Map.Entry<String, Long>> sources = new ArrayList<>(countsBySource.entrySet());
      // List.sort is stable, so equal counts keep first-seen order.
      sources.sort(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder()));
      List<SourceCount> top = new ArrayList<>(Math.min(TOP_SOURCES, sources.size()));
      for (Map.Entry<String, Long> entry : sources) {
        if (top.size() == TOP_SOURCES) {
          break;
        }
        top.add(new SourceCount(entry.getKey(), entry.getValue()));
      }
      return new ThreatStatistics(countsByType, top, countsByLevel);
    } finally {
      lock.unlock();
    }
  }

  /** Clears every counter. */
  public void reset() {
    lock.lock();
    try {
      countsBySource.clear();
      countsByType.clear();
      countsByLevel.clear();
    } finally {
      lock.unlock();
    }
  }

  static ThreatLevel levelFor(long history, AttackType type) {
    if (history >= CRITICAL_THRESHOLD) {
      return ThreatLevel.CRITICAL;
    }
    if (history >= HIGH_THRESHOLD) {
      return ThreatLevel.HIGH;
    }
    if (history >= MEDIUM_THRESHOLD || type.isBruteForce()) {
      return ThreatLevel.MEDIUM;
    }
    return ThreatLevel.LOW;
  }

  static AttackPattern patternFor(AttackType type) {
    if (type.isBruteForce()) {
      return AttackPattern.BRUTE_FORCE;
    }
    if (type.isReconnaissance()) {
      return AttackPattern.RECONNAISSANCE;
    }
    return AttackPattern.EXPLOIT_ATTEMPT;
  }

  private static List<String> recommendationsFor(String sourceIp, ThreatLevel level, AttackPattern pattern) {
    List<String> out = new ArrayList<>(4);
    if (level.isHighOrAbove()) {
      out.add(String.format(BLOCK_IP, sourceIp));
    }
    switch (pattern) {
      case BRUTE_FORCE -> {
        out.add(ENABLE_LOCKOUT);
        out.add(KEY_BASED_LOGIN);
      }
      case RECONNAISSANCE -> {
        out.add(REVIEW_ENDPOINTS);
        out.add(ENABLE_WAF);
      }
      default -> out.add(INVESTIGATE);
    }
    if (level == ThreatLevel.CRITICAL) {
      out.add(ESCALATE);
    }
    return out;
  }

  private static String sourceKey(String sourceIp) {
    if (sourceIp == null || sourceIp.isBlank()) {
      return UNKNOWN_SOURCE;
    }
    return sourceIp.trim();
  }
}
