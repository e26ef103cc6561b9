package com.flamingo.ai.canlaw.config;

import com.flamingo.ai.canlaw.service.statute.model.ActDescriptor;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for statute parsing and corpus acquisition. */
@Configuration
@ConfigurationProperties(prefix = "canlaw")
@Validated
@Getter
@Setter
public class CanLawConfig {

  @Valid private Statute statute = new Statute();
  @Valid private Corpus corpus = new Corpus();

  @Getter
  @Setter
  public static class Statute {
    @NotBlank private String actCode = "cbca";
    @NotBlank private String actName = "Canada Business Corporations Act";
    private String consolidatedNumber = "C-44";

    /** Namespace tried first when locating top-level elements; blank disables it. */
    private String namespaceUri = "http://justice.gc.ca/lims";

    private String inputPath = "data/statutes/federal/C-44-CBCA.xml";
    private String outputPath = "data/processed/statutes/cbca_hierarchy.json";

    /** Parse {@link #inputPath} and write {@link #outputPath} when the application starts. */
    private boolean parseOnStartup = false;

    public ActDescriptor toActDescriptor() {
      return new ActDescriptor(actCode, actName, consolidatedNumber);
    }
  }

  /** Remote legal case corpora fetched before any parsing happens. */
  @Getter
  @Setter
  public static class Corpus {
    private String baseUrl = "https://datasets-server.huggingface.co";
    @NotBlank private String dataset = "refugee-law-lab/canadian-legal-data";

    /** Dataset configurations to fetch, e.g. {@code SCC} or {@code FC}. */
    @NotEmpty private List<String> configs = new ArrayList<>(List.of("SCC"));

    private String split = "train";

    /** Local root directory; each configuration lands in its own lower-cased sub-directory. */
    private String baseDir = "data/cases";

    /** Rows requested per page; the dataset server caps this at 100. */
    @Min(1)
    private int pageSize = 100;

    @Min(1)
    private int maxAttempts = 3;

    /** Fixed delay between attempts. */
    @Min(1)
    private long retryWaitMs = 10_000;

    private int readTimeoutMs = 60_000;

    private boolean downloadOnStartup = false;
  }
}
