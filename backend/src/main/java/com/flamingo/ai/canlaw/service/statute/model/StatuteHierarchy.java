package com.flamingo.ai.canlaw.service.statute.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Id-addressed tree of {@link StatuteNode}s for a single Act.
 *
 * <p>The hierarchy is the only mutator of its nodes. It starts with the Act root, grows
 * monotonically while the document is walked (no deletions, no re-parenting) and is sealed with
 * {@link #complete()} before it is handed to readers. Children are stored as id references resolved
 * through the node map, so no node owns another.
 *
 * <p>Not thread-safe while being built; safe to share for reading once complete.
 */
public class StatuteHierarchy {

  private final ActDescriptor act;
  private final String rootId;
  private final Map<String, StatuteNode> nodes = new LinkedHashMap<>();
  private boolean complete;

  /**
   * Creates a hierarchy containing only the given root.
   *
   * @param act the Act this tree describes
   * @param root node of kind {@link NodeKind#ACT} without a parent
   */
  public StatuteHierarchy(ActDescriptor act, StatuteNode root) {
    if (root.getKind() != NodeKind.ACT || !root.isRoot()) {
      throw new IllegalArgumentException("Root must be a parentless act node: " + root);
    }
    this.act = act;
    this.rootId = root.getId();
    nodes.put(rootId, root);
  }

  /**
   * Inserts a node and appends its id to its parent's children in one step.
   *
   * @throws IllegalStateException if the hierarchy is complete, the id is taken, or the parent is
   *     unknown
   */
  public void attach(StatuteNode node) {
    if (complete) {
      throw new IllegalStateException("Hierarchy for " + act.actCode() + " is already complete");
    }
    if (nodes.containsKey(node.getId())) {
      throw new IllegalStateException("Duplicate node id: " + node.getId());
    }
    StatuteNode parent = node.getParentId() != null ? nodes.get(node.getParentId()) : null;
    if (parent == null) {
      throw new IllegalStateException(
          "Unknown parent '" + node.getParentId() + "' for node " + node.getId());
    }
    nodes.put(node.getId(), node);
    parent.appendChild(node.getId());
  }

  public boolean contains(String id) {
    return nodes.containsKey(id);
  }

  /**
   * Returns {@code candidate} if unused, otherwise the first of {@code candidate_1}, {@code
   * candidate_2}, … that is not yet in the tree.
   */
  public String uniqueId(String candidate) {
    String id = candidate;
    int counter = 1;
    while (nodes.containsKey(id)) {
      id = candidate + "_" + counter++;
    }
    return id;
  }

  /** Marks the walk as finished; later {@link #attach} calls fail. */
  public void complete() {
    complete = true;
  }

  public boolean isComplete() {
    return complete;
  }

  public Optional<StatuteNode> node(String id) {
    return Optional.ofNullable(nodes.get(id));
  }

  public StatuteNode root() {
    return nodes.get(rootId);
  }

  /**
   * Display path from the root down to the given node, e.g. {@code [CBCA, PART X, 122, (1)]}.
   *
   * <p>Each step uses the node's label, else its title, else its kind. Unknown ids yield an empty
   * path.
   */
  public List<String> ancestorPath(String id) {
    List<String> path = new ArrayList<>();
    String currentId = id;
    while (currentId != null) {
      StatuteNode node = nodes.get(currentId);
      if (node == null) {
        break;
      }
      path.add(displayName(node));
      currentId = node.getParentId();
    }
    Collections.reverse(path);
    return path;
  }

  /** Direct children of a node in attachment order; empty for unknown ids. */
  public List<StatuteNode> childrenOf(String id) {
    StatuteNode node = nodes.get(id);
    if (node == null) {
      return List.of();
    }
    return node.getChildren().stream().map(nodes::get).filter(n -> n != null).toList();
  }

  public List<StatuteNode> nodesOfKind(NodeKind kind) {
    return nodes.values().stream().filter(n -> n.getKind() == kind).toList();
  }

  public List<StatuteNode> sections() {
    return nodesOfKind(NodeKind.SECTION);
  }

  /** First node, in insertion order, whose citation equals {@code citation} exactly. */
  public Optional<StatuteNode> findByCitation(String citation) {
    return nodes.values().stream().filter(n -> n.getCitation().equals(citation)).findFirst();
  }

  /**
   * Counts computed on demand: {@code total_nodes} followed by one entry per {@link NodeKind} in
   * declaration order ({@code acts}, {@code parts}, …, {@code subparagraphs}).
   */
  public Map<String, Integer> summaryStatistics() {
    Map<String, Integer> stats = new LinkedHashMap<>();
    stats.put("total_nodes", nodes.size());
    for (NodeKind kind : NodeKind.values()) {
      stats.put(kind.statisticsKey(), 0);
    }
    for (StatuteNode node : nodes.values()) {
      stats.merge(node.getKind().statisticsKey(), 1, Integer::sum);
    }
    return stats;
  }

  /** All nodes keyed by id, in insertion order. */
  public Map<String, StatuteNode> nodes() {
    return Collections.unmodifiableMap(nodes);
  }

  public int size() {
    return nodes.size();
  }

  public ActDescriptor getAct() {
    return act;
  }

  public String getRootId() {
    return rootId;
  }

  private static String displayName(StatuteNode node) {
    if (!node.getLabel().isEmpty()) {
      return node.getLabel();
    }
    if (!node.getTitle().isEmpty()) {
      return node.getTitle();
    }
    return node.getKind().wireName();
  }
}
