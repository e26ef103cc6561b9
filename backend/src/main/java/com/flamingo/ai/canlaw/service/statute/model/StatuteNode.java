package com.flamingo.ai.canlaw.service.statute.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import lombok.Builder;
import lombok.Getter;

/**
 * One entry in a statute hierarchy.
 *
 * <p>All fields except {@code children} are fixed at creation. Children are appended only by the
 * owning {@link StatuteHierarchy}, in document order, so the parent/child links stay consistent in
 * both directions.
 */
@Getter
@JsonPropertyOrder({
  "id",
  "kind",
  "parent_id",
  "children",
  "act_name",
  "label",
  "title",
  "text",
  "citation",
  "metadata"
})
public class StatuteNode {

  private final String id;
  private final NodeKind kind;

  @JsonProperty("parent_id")
  private final String parentId;

  private final List<String> children = new ArrayList<>();

  @JsonProperty("act_name")
  private final String actName;

  private final String label;
  private final String title;
  private final String text;
  private final String citation;
  private final NodeMetadata metadata;

  @Builder
  private StatuteNode(
      String id,
      NodeKind kind,
      String parentId,
      String actName,
      String label,
      String title,
      String text,
      String citation,
      NodeMetadata metadata) {
    this.id = Objects.requireNonNull(id, "id");
    this.kind = Objects.requireNonNull(kind, "kind");
    this.parentId = parentId;
    this.actName = actName != null ? actName : "";
    this.label = label != null ? label : "";
    this.title = title != null ? title : "";
    this.text = text != null ? text : "";
    this.citation = citation != null ? citation : "";
    this.metadata = metadata;
  }

  /** Ids of the direct children, in the order they were attached. */
  public List<String> getChildren() {
    return Collections.unmodifiableList(children);
  }

  @JsonIgnore
  public boolean isRoot() {
    return parentId == null;
  }

  void appendChild(String childId) {
    children.add(childId);
  }

  @Override
  public String toString() {
    return kind.wireName() + "[" + id + "]";
  }
}
