package com.adinsight.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Settings for every memory tier, one subsection per tier.
 *
 * application.yml:
 *
 * memory:
 *   sweep-interval-ms: 300000
 *   short-term:
 *     max-items: 1000
 *     ttl-seconds: 3600
 *   long-term:
 *     max-items: 10000
 *     persistence-file: data/memory/long_term.json
 *   episodic:
 *     max-sessions: 100
 *     session-ttl-hours: 24
 *   semantic:
 *     max-items: 5000
 *     knowledge-graph-file: data/memory/semantic_graph.json
 */
@ConfigurationProperties(prefix = "memory")
public record MemoryProperties(
    @DefaultValue("300000") long sweepIntervalMs,
    @DefaultValue ShortTerm shortTerm,
    @DefaultValue LongTerm longTerm,
    @DefaultValue Episodic episodic,
    @DefaultValue Semantic semantic
) {

  public record ShortTerm(
      @DefaultValue("1000") int maxItems,
      @DefaultValue("3600") long ttlSeconds
  ) {}

  public record LongTerm(
      @DefaultValue("10000") int maxItems,
      @DefaultValue("data/memory/long_term.json") String persistenceFile
  ) {}

  public record Episodic(
      @DefaultValue("100") int maxSessions,
      @DefaultValue("24") long sessionTtlHours
  ) {}

  /** {@code maxItems} caps the number of graph nodes. */
  public record Semantic(
      @DefaultValue("5000") int maxItems,
      @DefaultValue("data/memory/semantic_graph.json") String knowledgeGraphFile
  ) {}
}
