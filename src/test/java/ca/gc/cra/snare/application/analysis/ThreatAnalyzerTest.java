package ca.gc.cra.snare.application.analysis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.snare.domain.attack.AttackPattern;
import ca.gc.cra.snare.domain.attack.AttackType;
import ca.gc.cra.snare.domain.attack.CapturedAttack;
import ca.gc.cra.snare.domain.attack.Protocol;
import ca.gc.cra.snare.domain.attack.SourceCount;
import ca.gc.cra.snare.domain.attack.ThreatAssessment;
import ca.gc.cra.snare.domain.attack.ThreatLevel;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class ThreatAnalyzerTest {
  private final ThreatAnalyzer analyzer = new ThreatAnalyzer();

  @Test
  void bruteForceEscalatesAtThresholds() {
    List<ThreatLevel> levels = new ArrayList<>();
    for (int i = 0; i < 25; i++) {
      levels.add(analyzer.analyze(attack("198.51.100.7", AttackType.SSH_BRUTE_FORCE)).threatLevel());
    }

    assertEquals(ThreatLevel.MEDIUM, levels.get(0));
    assertEquals(ThreatLevel.MEDIUM, levels.get(8));
    assertEquals(ThreatLevel.HIGH, levels.get(9));
    assertEquals(ThreatLevel.HIGH, levels.get(23));
    assertEquals(ThreatLevel.CRITICAL, levels.get(24));
  }

  @Test
  void probesStartLowAndReachMediumAtThree() {
    assertEquals(ThreatLevel.LOW, analyzer.analyze(attack("192.0.2.1", AttackType.HTTP_PROBE)).threatLevel());
    assertEquals(ThreatLevel.LOW, analyzer.analyze(attack("192.0.2.1", AttackType.HTTP_PROBE)).threatLevel());
    assertEquals(ThreatLevel.MEDIUM, analyzer.analyze(attack("192.0.2.1", AttackType.HTTP_PROBE)).threatLevel());
  }

  @Test
  void twelveProbesFromOneSourceEndHighOrAbove() {
    ThreatAssessment last = null;
    for (int i = 0; i < 12; i++) {
      last = analyzer.analyze(attack("5.5.5.5", AttackType.HTTP_PROBE));
    }

    assertTrue(last.threatLevel().isHighOrAbove());
    assertEquals(AttackPattern.RECONNAISSANCE, last.attackPattern());
    assertEquals(12, analyzer.attackHistory("5.5.5.5"));
  }

  @Test
  void patternFollowsAttackType() {
    assertEquals(AttackPattern.BRUTE_FORCE, ThreatAnalyzer.patternFor(AttackType.FTP_BRUTE_FORCE));
    assertEquals(AttackPattern.RECONNAISSANCE, ThreatAnalyzer.patternFor(AttackType.HTTP_PROBE));
    assertEquals(AttackPattern.EXPLOIT_ATTEMPT, ThreatAnalyzer.patternFor(AttackType.UNKNOWN));
  }

  @Test
  void recommendationsReflectLevelAndPattern() {
    ThreatAssessment first = analyzer.analyze(attack("203.0.113.4", AttackType.SSH_BRUTE_FORCE));
    assertEquals(List.of(ThreatAnalyzer.ENABLE_LOCKOUT, ThreatAnalyzer.KEY_BASED_LOGIN), first.recommendations());

    ThreatAssessment critical = null;
    for (int i = 1; i < 25; i++) {
      critical = analyzer.analyze(attack("203.0.113.4", AttackType.SSH_BRUTE_FORCE));
    }
    assertEquals(ThreatLevel.CRITICAL, critical.threatLevel());
    assertEquals("Block IP 203.0.113.4 immediately at the firewall level.", critical.recommendations().get(0));
    assertEquals(ThreatAnalyzer.ESCALATE, critical.recommendations().get(critical.recommendations().size() - 1));
  }

  @Test
  void statisticsTotalsMatchPerTypeCounts() {
    analyzer.analyze(attack("10.0.0.1", AttackType.SSH_BRUTE_FORCE));
    analyzer.analyze(attack("10.0.0.2", AttackType.HTTP_PROBE));
    analyzer.analyze(attack("10.0.0.2", AttackType.FTP_BRUTE_FORCE));

    ThreatStatistics stats = analyzer.statistics();

    assertEquals(3, stats.totalAttacks());
    assertEquals(stats.totalAttacks(), stats.countsByType().values().stream().mapToLong(Long::longValue).sum());
    assertEquals(stats.totalAttacks(), stats.countsByLevel().values().stream().mapToLong(Long::longValue).sum());
    assertEquals(new SourceCount("10.0.0.2", 2), stats.topSources().get(0));
  }

  @Test
  void topSourcesCapAtTenAndKeepFirstSeenOrderOnTies() {
    for (int i = 1; i <= 12; i++) {
      analyzer.analyze(attack("10.1.0." + i, AttackType.HTTP_PROBE));
    }
    analyzer.analyze(attack("10.1.0.12", AttackType.HTTP_PROBE));

    List<SourceCount> top = analyzer.statistics().topSources();

    assertEquals(ThreatAnalyzer.TOP_SOURCES, top.size());
    assertEquals("10.1.0.12", top.get(0).sourceIp());
    assertEquals("10.1.0.1", top.get(1).sourceIp());
    assertEquals("10.1.0.9", top.get(9).sourceIp());
  }

  @Test
  void resetClearsHistory() {
    analyzer.analyze(attack("10.0.0.1", AttackType.SSH_BRUTE_FORCE));
    analyzer.reset();

    assertEquals(0, analyzer.attackHistory("10.0.0.1"));
    assertEquals(0, analyzer.statistics().totalAttacks());
    assertTrue(analyzer.statistics().topSources().isEmpty());
  }

  @Test
  void concurrentAnalysisCountsEveryAttack() throws Exception {
    int threads = 8;
    int perThread = 50;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    try {
      for (int t = 0; t < threads; t++) {
        pool.execute(() -> {
          try {
            start.await();
          } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return;
          }
          for (int i = 0; i < perThread; i++) {
            analyzer.analyze(attack("172.16.0.1", AttackType.SSH_BRUTE_FORCE));
          }
        });
      }
      start.countDown();
    } finally {
      pool.shutdown();
      assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
    }

    assertEquals(threads * perThread, analyzer.attackHistory("172.16.0.1"));
    assertEquals(threads * perThread, analyzer.statistics().totalAttacks());
  }

  private static CapturedAttack attack(String ip, AttackType type) {
    return new CapturedAttack(Instant.parse("2024-05-01T00:00:00Z"), ip, 50_000, protocolOf(type), type, "");
  }

  private static Protocol protocolOf(AttackType type) {
    return type == AttackType.HTTP_PROBE ? Protocol.HTTP
        : type == AttackType.FTP_BRUTE_FORCE ? Protocol.FTP : Protocol.SSH;
  }
}
