package com.flamingo.ai.canlaw.service.statute;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.canlaw.config.CanLawConfig;
import com.flamingo.ai.canlaw.exception.StatuteParsingException;
import com.flamingo.ai.canlaw.service.statute.model.ActDescriptor;
import com.flamingo.ai.canlaw.service.statute.model.StatuteHierarchy;
import com.flamingo.ai.canlaw.service.statute.parsing.StatuteParser;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("StatuteIngestionService Tests")
class StatuteIngestionServiceTest {

  @Mock private StatuteParser statuteParser;
  @Mock private StatuteHierarchyWriter hierarchyWriter;

  private StatuteRegistry statuteRegistry;
  private CanLawConfig canLawConfig;
  private StatuteIngestionService service;

  @BeforeEach
  void setUp() {
    statuteRegistry = new StatuteRegistry();
    canLawConfig = new CanLawConfig();
    canLawConfig.getStatute().setInputPath("in/cbca.xml");
    canLawConfig.getStatute().setOutputPath("out/cbca.json");
    service =
        new StatuteIngestionService(statuteParser, hierarchyWriter, statuteRegistry, canLawConfig);
  }

  @Test
  @DisplayName("should parse, write, then register the configured act")
  void shouldIngestConfiguredAct() {
    StatuteHierarchy hierarchy = StatuteTestFixtures.smallCbca(true);
    ActDescriptor act = canLawConfig.getStatute().toActDescriptor();
    when(statuteParser.parse(Path.of("in/cbca.xml"), act)).thenReturn(hierarchy);

    StatuteHierarchy result = service.ingestConfigured();

    assertThat(result).isSameAs(hierarchy);
    InOrder order = inOrder(statuteParser, hierarchyWriter);
    order.verify(statuteParser).parse(Path.of("in/cbca.xml"), act);
    order.verify(hierarchyWriter).write(hierarchy, Path.of("out/cbca.json"));
    assertThat(statuteRegistry.require("cbca")).isSameAs(hierarchy);
  }

  @Test
  @DisplayName("should leave output and registry untouched when parsing fails")
  void shouldNotWriteOrRegister_whenParseFails() {
    when(statuteParser.parse(any(Path.class), any(ActDescriptor.class)))
        .thenThrow(new StatuteParsingException("cbca", "Could not find Body element"));

    assertThatThrownBy(() -> service.ingestConfigured())
        .isInstanceOf(StatuteParsingException.class);

    verify(hierarchyWriter, never()).write(any(), any());
    assertThat(statuteRegistry.actCodes()).isEmpty();
  }
}
