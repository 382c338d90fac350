package com.flamingo.ai.chunkgate.config;

import com.flamingo.ai.chunkgate.service.filter.ChunkFilteringOptions;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for chunk filtering. */
@Configuration
@ConfigurationProperties(prefix = "chunk-filter")
@Getter
@Setter
public class ChunkFilterConfig {

  private Defaults defaults = new Defaults();
  private Executor executor = new Executor();

  /** Builds the options used when a caller passes none. */
  public ChunkFilteringOptions toOptions() {
    return ChunkFilteringOptions.builder()
        .minRelevanceScore(defaults.getMinRelevanceScore())
        .maxChunks(defaults.getMaxChunks())
        .preserveOrder(defaults.isPreserveOrder())
        .qualityWeight(defaults.getQualityWeight())
        .useSelfReflection(defaults.isUseSelfReflection())
        .useCriticValidation(defaults.isUseCriticValidation())
        .batchSize(defaults.getBatchSize())
        .build();
  }

  /** Default filtering options. */
  @Getter
  @Setter
  public static class Defaults {
    private double minRelevanceScore = 0.7;

    /** Unset means no cap. */
    private Integer maxChunks;

    private boolean preserveOrder = false;

    /** 0 = pure relevance, 1 = pure quality. */
    private double qualityWeight = 0.3;

    private boolean useSelfReflection = true;
    private boolean useCriticValidation = true;
    private int batchSize = 5;
  }

  /** Thread pool running per-chunk assessments. */
  @Getter
  @Setter
  public static class Executor {
    private int corePoolSize = 5;
    private int maxPoolSize = 20;
    private int queueCapacity = 100;
  }
}
