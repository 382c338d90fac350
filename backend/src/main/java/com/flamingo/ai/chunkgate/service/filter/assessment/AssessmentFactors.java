package com.flamingo.ai.chunkgate.service.filter.assessment;

import com.flamingo.ai.chunkgate.service.filter.model.AssessmentFactor;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Ordered merge of factor lists across stages. */
final class AssessmentFactors {

  private AssessmentFactors() {}

  /**
   * Appends later-stage factors to the accumulated list. A factor whose name already occurs is
   * folded into the first occurrence via {@link AssessmentFactor#mergedWith}; new names keep their
   * arrival order.
   *
   * @return a new list; neither argument is modified
   */
  static List<AssessmentFactor> merge(
      List<AssessmentFactor> accumulated, List<AssessmentFactor> later) {
    List<AssessmentFactor> merged = new ArrayList<>(accumulated);
    Map<String, Integer> firstIndex = new LinkedHashMap<>();
    for (int i = 0; i < merged.size(); i++) {
      firstIndex.putIfAbsent(merged.get(i).name(), i);
    }

    for (AssessmentFactor factor : later) {
      Integer index = firstIndex.get(factor.name());
      if (index != null) {
        merged.set(index, merged.get(index).mergedWith(factor));
      } else {
        firstIndex.put(factor.name(), merged.size());
        merged.add(factor);
      }
    }
    return merged;
  }
}
