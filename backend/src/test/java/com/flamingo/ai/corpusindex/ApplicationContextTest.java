package com.flamingo.ai.corpusindex;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.corpusindex.job.CorpusJobRunner;
import com.flamingo.ai.corpusindex.service.dedup.ClaimDeduplicationService;
import com.flamingo.ai.corpusindex.service.index.ChunkIndex;
import com.flamingo.ai.corpusindex.service.index.CorpusIndexService;
import com.flamingo.ai.corpusindex.service.index.IndexBackend;
import com.flamingo.ai.corpusindex.service.taxonomy.TaxonomyBuildService;
import com.flamingo.ai.corpusindex.service.taxonomy.TaxonomyStore;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Verifies the application context loads against the in-memory database and the local index. The
 * model beans are mocked so no API key or network is needed.
 */
@SpringBootTest
@ActiveProfiles("test")
class ApplicationContextTest {

  @MockitoBean private ChatModel chatModel;
  @MockitoBean private EmbeddingModel embeddingModel;

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("All pipeline beans should be available")
  void pipelineBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(CorpusIndexService.class)).isNotNull();
    assertThat(applicationContext.getBean(TaxonomyBuildService.class)).isNotNull();
    assertThat(applicationContext.getBean(TaxonomyStore.class)).isNotNull();
    assertThat(applicationContext.getBean(ClaimDeduplicationService.class)).isNotNull();
    assertThat(applicationContext.getBean(CorpusJobRunner.class)).isNotNull();
  }

  @Test
  @DisplayName("The configured local index should back the chunk index bean")
  void chunkIndexShouldUseConfiguredBackend() {
    assertThat(applicationContext.getBean(ChunkIndex.class).backend())
        .isEqualTo(IndexBackend.LOCAL);
  }
}
