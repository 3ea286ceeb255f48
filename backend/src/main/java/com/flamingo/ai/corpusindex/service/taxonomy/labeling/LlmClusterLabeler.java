package com.flamingo.ai.corpusindex.service.taxonomy.labeling;

import com.flamingo.ai.corpusindex.agent.ClusterLabelingAgent;
import com.flamingo.ai.corpusindex.agent.dto.ClusterLabelResult;
import com.flamingo.ai.corpusindex.exception.ClusterLabelingException;
import com.flamingo.ai.corpusindex.service.taxonomy.model.ClusterLabel;
import com.flamingo.ai.corpusindex.service.taxonomy.model.DocumentVector;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** {@link ClusterLabeler} backed by the LLM labeling agent. Rejects malformed answers. */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmClusterLabeler implements ClusterLabeler {

  public static final String SOURCE = "llm";
  static final int MAX_ABSTRACT_CHARS = 300;
  static final int MAX_DESCRIPTION_CHARS = 300;
  static final int MIN_KEYWORDS = 3;
  static final int MAX_KEYWORDS = 5;

  private final ClusterLabelingAgent clusterLabelingAgent;

  @Override
  public ClusterLabel label(int clusterId, List<DocumentVector> sample) {
    if (sample.isEmpty()) {
      throw new ClusterLabelingException(clusterId, "no member documents");
    }
    ClusterLabelResult result;
    try {
      result = clusterLabelingAgent.label(describe(sample));
    } catch (RuntimeException e) {
      throw new ClusterLabelingException(clusterId, e.getMessage(), e);
    }
    return validate(clusterId, result);
  }

  static String describe(List<DocumentVector> sample) {
    StringBuilder text = new StringBuilder();
    for (int i = 0; i < sample.size(); i++) {
      DocumentVector document = sample.get(i);
      String abstractText = document.abstractText() == null ? "" : document.abstractText();
      if (abstractText.length() > MAX_ABSTRACT_CHARS) {
        abstractText = abstractText.substring(0, MAX_ABSTRACT_CHARS) + "...";
      }
      text.append(i + 1).append(". ").append(document.title()).append('\n');
      if (!abstractText.isBlank()) {
        text.append("   ").append(abstractText).append('\n');
      }
    }
    return text.toString();
  }

  private static ClusterLabel validate(int clusterId, ClusterLabelResult result) {
    if (result == null || result.label() == null || result.label().isBlank()) {
      throw new ClusterLabelingException(clusterId, "missing label");
    }
    if (result.description() == null || result.description().length() > MAX_DESCRIPTION_CHARS) {
      throw new ClusterLabelingException(clusterId, "missing or oversized description");
    }
    List<String> keywords = new ArrayList<>();
    if (result.keywords() != null) {
      for (String keyword : result.keywords()) {
        if (keyword != null && !keyword.isBlank()) {
          keywords.add(keyword.trim());
        }
      }
    }
    if (keywords.size() < MIN_KEYWORDS || keywords.size() > MAX_KEYWORDS) {
      throw new ClusterLabelingException(
          clusterId, "expected 3-5 keywords but got " + keywords.size());
    }
    log.debug("Cluster {} labeled '{}'", clusterId, result.label());
    return new ClusterLabel(result.label().trim(), result.description().trim(), keywords, SOURCE);
  }
}
