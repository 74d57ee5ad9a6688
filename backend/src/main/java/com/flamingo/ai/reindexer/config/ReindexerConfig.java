package com.flamingo.ai.reindexer.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the revisioned re-indexing pipeline. */
@Configuration
@ConfigurationProperties(prefix = "reindexer")
@Getter
@Setter
public class ReindexerConfig {

  private List<Index> indices = new ArrayList<>();
  private Extraction extraction = new Extraction();
  private ContentServer contentServer = new ContentServer();
  private Search search = new Search();
  private Build build = new Build();

  /** One logical index; its id is the alias name and the content server dimension. */
  @Getter
  @Setter
  public static class Index {
    private String id;

    /**
     * Classpath location of a create-index body ({@code settings} and {@code mappings}). Each new
     * generation is created from it; without one the generation uses dynamic mapping.
     */
    private String schemaResource;
  }

  @Getter
  @Setter
  public static class Extraction {
    /** Mime types eligible for indexing. Nodes of any other type are skipped. */
    private List<String> supportedMimeTypes = new ArrayList<>();

    /** Node metadata attribute that excludes a node from indexing when truthy. */
    private String excludeAttribute = "excludeFromSearch";

    /** Whether nodes carrying the hidden visibility flag are skipped. */
    private boolean skipHidden = true;
  }

  @Getter
  @Setter
  public static class ContentServer {
    private String baseUrl = "http://localhost:8080/contentserver";
    private String repoPath = "/getRepo";
    private String urisPath = "/getURIs";
    private int readTimeoutMs = 30000;

    /** Buffer limit for the repo response; whole trees can be large. */
    private int maxInMemorySize = 64 * 1024 * 1024;
  }

  @Getter
  @Setter
  public static class Search {
    /** Name of the stored search template ensured on every initialize. */
    private String presetName = "default";

    /** Classpath location of the stored script body; no preset is managed when unset. */
    private String presetResource;

    /** Fields matched by simple search. */
    private List<String> queryFields = new ArrayList<>(List.of("uri"));

    private int defaultPerPage = 10;
  }

  @Getter
  @Setter
  public static class Build {
    private boolean runOnStartup = false;

    /** Spring cron expression for scheduled builds; "-" disables scheduling. */
    private String cron = "-";

    /**
     * Whether documents rejected inside an otherwise accepted bulk call taint the run. Off by
     * default: such failures are logged and counted only.
     */
    private boolean taintOnPartialFailure = false;
  }
}
