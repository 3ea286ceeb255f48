package com.flamingo.ai.corpusindex.service.taxonomy.labeling;

import com.flamingo.ai.corpusindex.service.taxonomy.model.ClusterLabel;
import com.flamingo.ai.corpusindex.service.taxonomy.model.DocumentVector;
import java.util.List;

/** Names a cluster from a sample of its most representative documents. */
public interface ClusterLabeler {

  /**
   * Labels one cluster.
   *
   * @param clusterId cluster being labeled
   * @param sample member documents, most confident first
   * @return a well-formed label
   * @throws com.flamingo.ai.corpusindex.exception.ClusterLabelingException when the labeler fails
   *     or its output is malformed
   */
  ClusterLabel label(int clusterId, List<DocumentVector> sample);
}
