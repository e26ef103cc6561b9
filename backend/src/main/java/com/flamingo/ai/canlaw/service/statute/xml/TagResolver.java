package com.flamingo.ai.canlaw.service.statute.xml;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/**
 * Namespace-tolerant element access for statute XML.
 *
 * <p>Act revisions are inconsistently namespaced, so element roles are compared by local name and
 * lookups fall back to unqualified names when the qualified lookup finds nothing. Absence is
 * reported as an empty result, never as an exception.
 */
public final class TagResolver {

  private TagResolver() {}

  /**
   * Role name of an element without any namespace prefix ({@code lims:Body} and {@code
   * {http://…}Body} both resolve to {@code Body}).
   */
  public static String localTag(Element element) {
    String tag = element.getLocalName() != null ? element.getLocalName() : element.getTagName();
    int brace = tag.lastIndexOf('}');
    if (brace >= 0) {
      tag = tag.substring(brace + 1);
    }
    int colon = tag.indexOf(':');
    if (colon >= 0) {
      tag = tag.substring(colon + 1);
    }
    return tag;
  }

  /**
   * Finds the first descendant named {@code localName}, trying {@code namespaceUri} first and then
   * the unqualified name.
   *
   * @param container element whose descendants are searched
   * @param namespaceUri declared namespace to try first; may be null or blank to skip that step
   * @param localName element name without prefix
   */
  public static Optional<Element> findTolerant(
      Element container, String namespaceUri, String localName) {
    if (container == null) {
      return Optional.empty();
    }
    if (namespaceUri != null && !namespaceUri.isBlank()) {
      Optional<Element> qualified =
          firstElement(container.getElementsByTagNameNS(namespaceUri, localName));
      if (qualified.isPresent()) {
        return qualified;
      }
    }
    return firstElement(container.getElementsByTagName(localName));
  }

  /** Direct element children of {@code parent}, in document order. */
  public static List<Element> childElements(Element parent) {
    List<Element> elements = new ArrayList<>();
    NodeList children = parent.getChildNodes();
    for (int i = 0; i < children.getLength(); i++) {
      Node child = children.item(i);
      if (child.getNodeType() == Node.ELEMENT_NODE) {
        elements.add((Element) child);
      }
    }
    return elements;
  }

  /** Direct element children of {@code parent} whose local tag is {@code localName}. */
  public static List<Element> childElements(Element parent, String localName) {
    return childElements(parent).stream().filter(e -> localName.equals(localTag(e))).toList();
  }

  /** First direct child of {@code parent} whose local tag is {@code localName}. */
  public static Optional<Element> firstChild(Element parent, String localName) {
    return childElements(parent).stream().filter(e -> localName.equals(localTag(e))).findFirst();
  }

  private static Optional<Element> firstElement(NodeList nodes) {
    for (int i = 0; i < nodes.getLength(); i++) {
      if (nodes.item(i) instanceof Element element) {
        return Optional.of(element);
      }
    }
    return Optional.empty();
  }
}
