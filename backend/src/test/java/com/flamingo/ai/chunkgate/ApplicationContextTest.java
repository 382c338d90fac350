package com.flamingo.ai.chunkgate;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.chunkgate.api.rest.ChunkFilterController;
import com.flamingo.ai.chunkgate.completion.CancellationSignal;
import com.flamingo.ai.chunkgate.completion.TextCompletionService;
import com.flamingo.ai.chunkgate.config.ChunkFilterConfig;
import com.flamingo.ai.chunkgate.service.filter.ChunkFilteringOptions;
import com.flamingo.ai.chunkgate.service.filter.ChunkFilteringService;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.concurrent.Executor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Integration test that verifies the Spring application context loads correctly. Uses @MockitoBean
 * to mock the language models so the test can run without an API key.
 */
@SpringBootTest
class ApplicationContextTest {

  @MockitoBean private ChatModel chatModel;
  @MockitoBean private StreamingChatModel streamingChatModel;

  @Autowired private ApplicationContext applicationContext;

  @Autowired
  @Qualifier("assessmentExecutor")
  private Executor assessmentExecutor;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
    assertThat(assessmentExecutor).isNotNull();
  }

  @Test
  @DisplayName("Core beans should be available")
  void coreBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(ChunkFilteringService.class)).isNotNull();
    assertThat(applicationContext.getBean(TextCompletionService.class)).isNotNull();
    assertThat(applicationContext.getBean(ChunkFilterController.class)).isNotNull();
  }

  @Test
  @DisplayName("Configured defaults should match application.yml")
  void configuredDefaultsShouldMatchApplicationYml() {
    ChunkFilteringOptions options = applicationContext.getBean(ChunkFilterConfig.class).toOptions();

    assertThat(options.getMinRelevanceScore()).isEqualTo(0.7);
    assertThat(options.getQualityWeight()).isEqualTo(0.3);
    assertThat(options.getBatchSize()).isEqualTo(5);
    assertThat(options.getMaxChunks()).isNull();
  }

  @Test
  @DisplayName("Filtering calls should be recorded by the filter timer")
  void filteringShouldBeTimed() {
    ChunkFilteringService service = applicationContext.getBean(ChunkFilteringService.class);
    MeterRegistry registry = applicationContext.getBean(MeterRegistry.class);

    service.filter(List.of(), null, ChunkFilteringOptions.defaults(), CancellationSignal.none());

    assertThat(registry.find("chunk_filter.filter").timer()).isNotNull();
    assertThat(registry.find("chunk_filter.filter").timer().count()).isGreaterThanOrEqualTo(1L);
  }
}
