package com.adinsight.memory;

import com.adinsight.model.RelatedNode;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Knowledge graph of valued nodes joined by directed, typed, weighted edges.
 *
 * <p>Each edge bumps the connection counter of both its endpoints. The counter is only
 * an eviction priority: when the graph is full the node with the lowest counter goes
 * first, earliest inserted on ties. Deleting a node also removes every edge that points
 * at it. The whole graph is rewritten to disk after each mutation.
 */
public class RelationalMemoryStore implements MemoryStore {

  private static final Logger log = LoggerFactory.getLogger(RelationalMemoryStore.class);

  private final Map<String, Node> nodes = new LinkedHashMap<>();
  private final Map<String, List<Edge>> edges = new LinkedHashMap<>();
  private final ReentrantLock lock = new ReentrantLock();

  private final int maxNodes;
  private final SnapshotFile<Snapshot> snapshotFile;
  private final Clock clock;
  private final MemoryMetrics metrics;

  public RelationalMemoryStore(
      int maxNodes,
      Path knowledgeGraphFile,
      ObjectMapper mapper,
      Clock clock,
      MemoryMetrics metrics) {
    if (maxNodes <= 0) {
      throw new IllegalArgumentException("maxNodes must be positive: " + maxNodes);
    }
    this.maxNodes = maxNodes;
    this.snapshotFile = new SnapshotFile<>(knowledgeGraphFile, mapper, Snapshot.class);
    this.clock = clock;
    this.metrics = metrics;
    load();
  }

  /**
   * Creates a node, or replaces the value of an existing one. Edges and counters of an
   * existing node are kept.
   */
  @Override
  public boolean put(String key, JsonNode value) {
    if (key == null) {
      return false;
    }
    lock.lock();
    try {
      JsonNode payload = value == null ? NullNode.getInstance() : value;
      Node existing = nodes.get(key);
      if (existing != null) {
        existing.value = payload;
      } else {
        while (nodes.size() >= maxNodes) {
          evictLeastConnected();
        }
        nodes.put(key, new Node(payload, clock.instant()));
      }
      edges.computeIfAbsent(key, k -> new ArrayList<>());

      persist();
      log.debug("Stored node={} tier=relational size={}", key, nodes.size());
      return true;
    } catch (RuntimeException e) {
      log.error("Failed to store node={} tier=relational", key, e);
      return false;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public Optional<JsonNode> get(String key) {
    if (key == null) {
      return Optional.empty();
    }
    lock.lock();
    try {
      Node node = nodes.get(key);
      if (node == null) {
        return Optional.empty();
      }
      node.accessCount++;
      node.lastAccessed = clock.instant();
      return Optional.of(node.value);
    } catch (RuntimeException e) {
      log.error("Failed to retrieve node={} tier=relational", key, e);
      return Optional.empty();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean delete(String key) {
    lock.lock();
    try {
      if (!nodes.containsKey(key)) {
        return false;
      }
      removeNode(key);
      persist();
      log.debug("Deleted node={} tier=relational", key);
      return true;
    } catch (RuntimeException e) {
      log.error("Failed to delete node={} tier=relational", key, e);
      return false;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean clear() {
    lock.lock();
    try {
      nodes.clear();
      edges.clear();
      persist();
      log.info("Cleared tier=relational");
      return true;
    } catch (RuntimeException e) {
      log.error("Failed to clear tier=relational", e);
      return false;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean exists(String key) {
    lock.lock();
    try {
      return nodes.containsKey(key);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public List<String> listKeys() {
    lock.lock();
    try {
      return List.copyOf(nodes.keySet());
    } finally {
      lock.unlock();
    }
  }

  /**
   * Adds a directed edge. Both endpoints must already exist.
   */
  public boolean addRelationship(String fromKey, String toKey, String relationType, double weight) {
    if (relationType == null || relationType.isBlank()) {
      log.warn("Rejected relationship from={} to={} with blank type", fromKey, toKey);
      return false;
    }
    lock.lock();
    try {
      Node from = nodes.get(fromKey);
      Node to = nodes.get(toKey);
      if (from == null || to == null) {
        log.warn("Rejected relationship type={} from={} to={}: missing endpoint", relationType, fromKey, toKey);
        return false;
      }
      edges.computeIfAbsent(fromKey, k -> new ArrayList<>())
          .add(new Edge(toKey, relationType, weight, clock.instant()));
      from.connections++;
      to.connections++;

      persist();
      log.debug("Added relationship type={} from={} to={} weight={}", relationType, fromKey, toKey, weight);
      return true;
    } catch (RuntimeException e) {
      log.error("Failed to add relationship type={} from={} to={}", relationType, fromKey, toKey, e);
      return false;
    } finally {
      lock.unlock();
    }
  }

  public boolean addRelationship(String fromKey, String toKey, String relationType) {
    return addRelationship(fromKey, toKey, relationType, 1.0);
  }

  /**
   * Outgoing edges of {@code key}, optionally limited to one relation type.
   */
  public List<RelatedNode> getRelated(String key, String relationType) {
    lock.lock();
    try {
      List<Edge> outgoing = edges.get(key);
      if (outgoing == null) {
        return List.of();
      }
      List<RelatedNode> related = new ArrayList<>();
      for (Edge edge : outgoing) {
        if (relationType == null || edge.type().equals(relationType)) {
          related.add(new RelatedNode(edge.to(), edge.type(), edge.weight()));
        }
      }
      return related;
    } catch (RuntimeException e) {
      log.error("Failed to read relationships of node={}", key, e);
      return List.of();
    } finally {
      lock.unlock();
    }
  }

  public List<RelatedNode> getRelated(String key) {
    return getRelated(key, null);
  }

  /** Connection counter of {@code key}, or -1 when the node does not exist. */
  public int connectionCount(String key) {
    lock.lock();
    try {
      Node node = nodes.get(key);
      return node == null ? -1 : node.connections;
    } finally {
      lock.unlock();
    }
  }

  private void removeNode(String key) {
    nodes.remove(key);
    List<Edge> outgoing = edges.remove(key);
    if (outgoing != null) {
      for (Edge edge : outgoing) {
        decrementConnections(edge.to());
      }
    }
    edges.forEach((source, list) -> {
      Iterator<Edge> it = list.iterator();
      while (it.hasNext()) {
        if (it.next().to().equals(key)) {
          it.remove();
          decrementConnections(source);
        }
      }
    });
  }

  private void decrementConnections(String key) {
    Node node = nodes.get(key);
    if (node != null && node.connections > 0) {
      node.connections--;
    }
  }

  private void evictLeastConnected() {
    String victim = null;
    int fewest = Integer.MAX_VALUE;
    for (Map.Entry<String, Node> entry : nodes.entrySet()) {
      if (entry.getValue().connections < fewest) {
        victim = entry.getKey();
        fewest = entry.getValue().connections;
      }
    }
    if (victim == null) {
      return;
    }
    removeNode(victim);
    metrics.evicted(MemoryTier.RELATIONAL, "least_connected");
    log.debug("Evicted node={} tier=relational reason=least_connected connections={}", victim, fewest);
  }

  private void load() {
    try {
      Optional<Snapshot> loaded = snapshotFile.read();
      if (loaded.isEmpty()) {
        log.info("No snapshot at {}, starting empty tier=relational", snapshotFile.path());
        return;
      }
      Snapshot snapshot = loaded.get();
      Instant now = clock.instant();
      if (snapshot.nodes() != null) {
        snapshot.nodes().forEach((key, data) -> nodes.put(key, Node.from(data, now)));
      }
      int dropped = 0;
      for (String key : nodes.keySet()) {
        List<Edge> stored = snapshot.edges() == null ? null : snapshot.edges().get(key);
        List<Edge> kept = new ArrayList<>();
        if (stored != null) {
          for (Edge edge : stored) {
            if (edge != null && edge.to() != null && nodes.containsKey(edge.to())) {
              kept.add(edge);
            } else {
              dropped++;
            }
          }
        }
        edges.put(key, kept);
      }
      if (dropped > 0) {
        log.warn("Dropped {} dangling edges while loading {}", dropped, snapshotFile.path());
      }
      recountConnections();
      log.info("Loaded {} nodes from {} tier=relational", nodes.size(), snapshotFile.path());
    } catch (IOException | RuntimeException e) {
      nodes.clear();
      edges.clear();
      log.error("Failed to load snapshot {}, starting empty tier=relational", snapshotFile.path(), e);
    }
  }

  /** Rebuilds every counter from the edges actually present. */
  private void recountConnections() {
    nodes.values().forEach(node -> node.connections = 0);
    edges.forEach((source, list) -> {
      for (Edge edge : list) {
        nodes.get(source).connections++;
        nodes.get(edge.to()).connections++;
      }
    });
  }

  private void persist() {
    long startNanos = System.nanoTime();
    try {
      Map<String, NodeData> nodeData = new LinkedHashMap<>();
      nodes.forEach((key, node) -> nodeData.put(key, node.toData()));
      Map<String, List<Edge>> edgeData = new LinkedHashMap<>();
      edges.forEach((key, list) -> edgeData.put(key, List.copyOf(list)));

      snapshotFile.write(new Snapshot(nodeData, edgeData, clock.instant()));
      metrics.persisted(MemoryTier.RELATIONAL, (System.nanoTime() - startNanos) / 1_000_000);
    } catch (IOException e) {
      metrics.persistFailed(MemoryTier.RELATIONAL);
      log.error("Failed to write snapshot {} tier=relational", snapshotFile.path(), e);
    }
  }

  private static final class Node {
    private JsonNode value;
    private final Instant createdAt;
    private Instant lastAccessed;
    private int accessCount;
    private int connections;

    private Node(JsonNode value, Instant createdAt) {
      this.value = value;
      this.createdAt = createdAt;
      this.lastAccessed = createdAt;
    }

    private static Node from(NodeData data, Instant fallback) {
      Instant created = data.timestamp() != null ? data.timestamp() : fallback;
      Node node = new Node(data.value() == null ? NullNode.getInstance() : data.value(), created);
      node.lastAccessed = data.lastAccessed() != null ? data.lastAccessed() : created;
      node.accessCount = data.accessCount();
      return node;
    }

    private NodeData toData() {
      return new NodeData(value, createdAt, accessCount, lastAccessed, connections);
    }
  }

  public record NodeData(
      JsonNode value,
      Instant timestamp,
      @JsonProperty("access_count") int accessCount,
      @JsonProperty("last_accessed") Instant lastAccessed,
      int connections
  ) {}

  public record Edge(
      String to,
      String type,
      double weight,
      Instant timestamp
  ) {}

  public record Snapshot(
      Map<String, NodeData> nodes,
      Map<String, List<Edge>> edges,
      @JsonProperty("last_saved") Instant lastSaved
  ) {}
}
