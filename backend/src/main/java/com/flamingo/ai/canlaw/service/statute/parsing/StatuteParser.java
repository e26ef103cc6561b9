package com.flamingo.ai.canlaw.service.statute.parsing;

import com.flamingo.ai.canlaw.service.statute.model.ActDescriptor;
import com.flamingo.ai.canlaw.service.statute.model.StatuteHierarchy;
import java.io.InputStream;
import java.nio.file.Path;

/**
 * Parses a statute document into a complete {@link StatuteHierarchy}.
 *
 * <p>Implementations must be stateless so a single instance can parse several Acts concurrently;
 * per-document walk state lives in a fresh walker for each call. A parse either returns a complete,
 * sealed hierarchy or throws once; no partial tree is ever returned.
 */
public interface StatuteParser {

  /**
   * Parses the given document stream.
   *
   * <p>The stream is read to the end and may be closed by the implementation; closing it again
   * afterwards is harmless.
   *
   * @param inputStream raw statute XML
   * @param act identity of the Act the document encodes
   * @return the sealed hierarchy
   * @throws com.flamingo.ai.canlaw.exception.StatuteParsingException if the document is not
   *     well-formed or has no body
   */
  StatuteHierarchy parse(InputStream inputStream, ActDescriptor act);

  /**
   * Parses a statute file that is already present on local storage.
   *
   * @throws com.flamingo.ai.canlaw.exception.StatuteParsingException if the file cannot be read
   *     or parsed
   */
  StatuteHierarchy parse(Path xmlPath, ActDescriptor act);
}
