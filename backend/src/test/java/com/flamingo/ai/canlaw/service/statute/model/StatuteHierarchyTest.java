package com.flamingo.ai.canlaw.service.statute.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("StatuteHierarchy Tests")
class StatuteHierarchyTest {

  private static final ActDescriptor CBCA =
      new ActDescriptor("cbca", "Canada Business Corporations Act", "C-44");

  private StatuteHierarchy hierarchy;

  @BeforeEach
  void setUp() {
    hierarchy =
        new StatuteHierarchy(
            CBCA,
            StatuteNode.builder()
                .id("cbca_root")
                .kind(NodeKind.ACT)
                .label("CBCA")
                .title("Canada Business Corporations Act")
                .citation("CBCA")
                .build());
  }

  private StatuteNode node(String id, NodeKind kind, String parentId, String label, String title) {
    return StatuteNode.builder()
        .id(id)
        .kind(kind)
        .parentId(parentId)
        .label(label)
        .title(title)
        .citation(id.toUpperCase())
        .build();
  }

  @Test
  @DisplayName("should link parent and child in one insertion")
  void shouldLinkParentAndChild_whenAttached() {
    hierarchy.attach(node("cbca_part_x", NodeKind.PART, "cbca_root", "PART X", "Directors"));
    hierarchy.attach(node("cbca_s122", NodeKind.SECTION, "cbca_part_x", "122", "Duty of care"));

    assertThat(hierarchy.root().getChildren()).containsExactly("cbca_part_x");
    assertThat(hierarchy.node("cbca_part_x").orElseThrow().getChildren())
        .containsExactly("cbca_s122");
    assertThat(hierarchy.node("cbca_s122").orElseThrow().getParentId()).isEqualTo("cbca_part_x");
  }

  @Test
  @DisplayName("should reject duplicate ids and unknown parents without side effects")
  void shouldRejectDuplicateAndOrphan() {
    hierarchy.attach(node("cbca_s1", NodeKind.SECTION, "cbca_root", "1", ""));

    StatuteNode duplicate = node("cbca_s1", NodeKind.SECTION, "cbca_root", "1", "");
    StatuteNode orphan = node("cbca_s2_1", NodeKind.SUBSECTION, "cbca_s2", "(1)", "");

    assertThatThrownBy(() -> hierarchy.attach(duplicate))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("Duplicate");
    assertThatThrownBy(() -> hierarchy.attach(orphan))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("Unknown parent");

    assertThat(hierarchy.size()).isEqualTo(2);
    assertThat(hierarchy.root().getChildren()).containsExactly("cbca_s1");
  }

  @Test
  @DisplayName("should reject insertions once complete")
  void shouldRejectInsertion_whenComplete() {
    StatuteNode section = node("cbca_s1", NodeKind.SECTION, "cbca_root", "1", "");
    hierarchy.complete();

    assertThat(hierarchy.isComplete()).isTrue();
    assertThatThrownBy(() -> hierarchy.attach(section))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  @DisplayName("should require a parentless act node as root")
  void shouldRejectNonActRoot() {
    assertThatThrownBy(
            () -> new StatuteHierarchy(CBCA, node("cbca_s1", NodeKind.SECTION, null, "1", "")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("should probe numeric suffixes until an id is free")
  void shouldProbeSuffixes_whenIdTaken() {
    hierarchy.attach(node("cbca_part_x", NodeKind.PART, "cbca_root", "PART X", ""));
    hierarchy.attach(node("h", NodeKind.HEADING, "cbca_part_x", "", "Duty"));
    hierarchy.attach(node("h_1", NodeKind.HEADING, "cbca_part_x", "", "Duty"));

    assertThat(hierarchy.uniqueId("fresh")).isEqualTo("fresh");
    assertThat(hierarchy.uniqueId("h")).isEqualTo("h_2");
  }

  @Test
  @DisplayName("should build ancestor path from label, then title, then kind")
  void shouldBuildAncestorPath() {
    hierarchy.attach(node("cbca_part_x", NodeKind.PART, "cbca_root", "PART X", "Directors"));
    hierarchy.attach(node("heading", NodeKind.HEADING, "cbca_part_x", "", "Duty of Care"));
    hierarchy.attach(node("cbca_s122", NodeKind.SECTION, "heading", "122", "Duty of care"));
    hierarchy.attach(node("anonymous", NodeKind.SUBSECTION, "cbca_s122", "", ""));

    assertThat(hierarchy.ancestorPath("anonymous"))
        .containsExactly("CBCA", "PART X", "Duty of Care", "122", "subsection");
    assertThat(hierarchy.ancestorPath("cbca_root")).containsExactly("CBCA");
    assertThat(hierarchy.ancestorPath("missing")).isEmpty();
  }

  @Test
  @DisplayName("should resolve children in attachment order")
  void shouldResolveChildrenInOrder() {
    hierarchy.attach(node("cbca_s2", NodeKind.SECTION, "cbca_root", "2", ""));
    hierarchy.attach(node("cbca_s1", NodeKind.SECTION, "cbca_root", "1", ""));

    List<StatuteNode> children = hierarchy.childrenOf("cbca_root");

    assertThat(children).extracting(StatuteNode::getId).containsExactly("cbca_s2", "cbca_s1");
    assertThat(hierarchy.childrenOf("missing")).isEmpty();
  }

  @Test
  @DisplayName("should filter nodes by kind and find by citation")
  void shouldFilterByKindAndCitation() {
    hierarchy.attach(node("cbca_part_i", NodeKind.PART, "cbca_root", "PART I", ""));
    hierarchy.attach(node("cbca_s1", NodeKind.SECTION, "cbca_part_i", "1", ""));
    hierarchy.attach(node("cbca_s2", NodeKind.SECTION, "cbca_part_i", "2", ""));

    assertThat(hierarchy.sections())
        .extracting(StatuteNode::getId)
        .containsExactly("cbca_s1", "cbca_s2");
    assertThat(hierarchy.nodesOfKind(NodeKind.SUBPARAGRAPH)).isEmpty();
    assertThat(hierarchy.findByCitation("CBCA_S2")).map(StatuteNode::getId).contains("cbca_s2");
    assertThat(hierarchy.findByCitation("CBCA s. 99")).isEmpty();
  }

  @Test
  @DisplayName("should count total and per-kind nodes on demand")
  void shouldComputeSummaryStatistics() {
    hierarchy.attach(node("cbca_part_i", NodeKind.PART, "cbca_root", "PART I", ""));
    hierarchy.attach(node("cbca_s1", NodeKind.SECTION, "cbca_part_i", "1", ""));

    Map<String, Integer> before = hierarchy.summaryStatistics();
    hierarchy.attach(node("cbca_s1_a", NodeKind.PARAGRAPH, "cbca_s1", "(a)", ""));
    Map<String, Integer> after = hierarchy.summaryStatistics();

    assertThat(before.keySet())
        .containsExactly(
            "total_nodes",
            "acts",
            "parts",
            "headings",
            "sections",
            "subsections",
            "paragraphs",
            "subparagraphs");
    assertThat(before).containsEntry("total_nodes", 3).containsEntry("paragraphs", 0);
    assertThat(after).containsEntry("total_nodes", 4).containsEntry("paragraphs", 1);
    assertThat(after).containsEntry("acts", 1).containsEntry("subsections", 0);
  }

  @Test
  @DisplayName("should expose a read-only children view")
  void shouldExposeReadOnlyChildren() {
    hierarchy.attach(node("cbca_s1", NodeKind.SECTION, "cbca_root", "1", ""));

    assertThatThrownBy(() -> hierarchy.root().getChildren().add("forged"))
        .isInstanceOf(UnsupportedOperationException.class);
    assertThatThrownBy(() -> hierarchy.nodes().remove("cbca_s1"))
        .isInstanceOf(UnsupportedOperationException.class);
  }
}
