package com.flamingo.ai.canlaw.api.dto.response;

import com.flamingo.ai.canlaw.service.statute.model.NodeMetadata;
import com.flamingo.ai.canlaw.service.statute.model.StatuteNode;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a single statute provision. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatuteNodeResponse {

  private String id;
  private String kind;
  private String parentId;
  private List<String> children;
  private String label;
  private String title;
  private String text;
  private String citation;
  private NodeMetadata metadata;

  /** Creates a StatuteNodeResponse from a hierarchy node. */
  public static StatuteNodeResponse fromNode(StatuteNode node) {
    return StatuteNodeResponse.builder()
        .id(node.getId())
        .kind(node.getKind().wireName())
        .parentId(node.getParentId())
        .children(List.copyOf(node.getChildren()))
        .label(node.getLabel())
        .title(node.getTitle())
        .text(node.getText())
        .citation(node.getCitation())
        .metadata(node.getMetadata())
        .build();
  }
}
