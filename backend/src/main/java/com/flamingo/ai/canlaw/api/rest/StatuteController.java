package com.flamingo.ai.canlaw.api.rest;

import com.flamingo.ai.canlaw.api.dto.response.StatuteNodeResponse;
import com.flamingo.ai.canlaw.api.dto.response.StatuteSummaryResponse;
import com.flamingo.ai.canlaw.exception.InvalidStatuteQueryException;
import com.flamingo.ai.canlaw.exception.StatuteNodeNotFoundException;
import com.flamingo.ai.canlaw.service.statute.StatuteRegistry;
import com.flamingo.ai.canlaw.service.statute.model.NodeKind;
import com.flamingo.ai.canlaw.service.statute.model.StatuteHierarchy;
import com.flamingo.ai.canlaw.service.statute.model.StatuteNode;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for navigating parsed statutes and resolving citations. */
@RestController
@RequestMapping("/api/statutes")
@RequiredArgsConstructor
public class StatuteController {

  private final StatuteRegistry statuteRegistry;

  /** Lists the act codes currently loaded. */
  @GetMapping
  public ResponseEntity<List<String>> getLoadedStatutes() {
    return ResponseEntity.ok(List.copyOf(statuteRegistry.actCodes()));
  }

  /** Gets the summary of a loaded Act. */
  @GetMapping("/{actCode}")
  public ResponseEntity<StatuteSummaryResponse> getStatute(@PathVariable String actCode) {
    return ResponseEntity.ok(
        StatuteSummaryResponse.fromHierarchy(statuteRegistry.require(actCode)));
  }

  /** Gets a node by id. */
  @GetMapping("/{actCode}/nodes/{nodeId}")
  public ResponseEntity<StatuteNodeResponse> getNode(
      @PathVariable String actCode, @PathVariable String nodeId) {
    return ResponseEntity.ok(StatuteNodeResponse.fromNode(requireNode(actCode, nodeId)));
  }

  /** Gets the direct children of a node in document order. */
  @GetMapping("/{actCode}/nodes/{nodeId}/children")
  public ResponseEntity<List<StatuteNodeResponse>> getChildren(
      @PathVariable String actCode, @PathVariable String nodeId) {
    StatuteHierarchy hierarchy = statuteRegistry.require(actCode);
    requireNode(actCode, nodeId);
    return ResponseEntity.ok(
        hierarchy.childrenOf(nodeId).stream().map(StatuteNodeResponse::fromNode).toList());
  }

  /** Gets the labels from the Act root down to a node. */
  @GetMapping("/{actCode}/nodes/{nodeId}/path")
  public ResponseEntity<List<String>> getPath(
      @PathVariable String actCode, @PathVariable String nodeId) {
    requireNode(actCode, nodeId);
    return ResponseEntity.ok(statuteRegistry.require(actCode).ancestorPath(nodeId));
  }

  /** Gets every node of one kind, e.g. {@code ?kind=section}. */
  @GetMapping("/{actCode}/nodes")
  public ResponseEntity<List<StatuteNodeResponse>> getNodesOfKind(
      @PathVariable String actCode, @RequestParam("kind") String kind) {
    NodeKind nodeKind;
    try {
      nodeKind = NodeKind.fromWireName(kind);
    } catch (IllegalArgumentException e) {
      throw new InvalidStatuteQueryException("kind", kind, e);
    }
    return ResponseEntity.ok(
        statuteRegistry.require(actCode).nodesOfKind(nodeKind).stream()
            .map(StatuteNodeResponse::fromNode)
            .toList());
  }

  /** Resolves an exact citation such as {@code CBCA s. 122(1)(a)}. */
  @GetMapping("/{actCode}/citations")
  public ResponseEntity<StatuteNodeResponse> resolveCitation(
      @PathVariable String actCode, @RequestParam("q") String citation) {
    StatuteNode node =
        statuteRegistry
            .require(actCode)
            .findByCitation(citation.trim())
            .orElseThrow(() -> new StatuteNodeNotFoundException(actCode, citation));
    return ResponseEntity.ok(StatuteNodeResponse.fromNode(node));
  }

  private StatuteNode requireNode(String actCode, String nodeId) {
    return statuteRegistry
        .require(actCode)
        .node(nodeId)
        .orElseThrow(() -> new StatuteNodeNotFoundException(actCode, nodeId));
  }
}
