package com.flamingo.ai.chunkgate.service.filter.assessment;

import com.flamingo.ai.chunkgate.service.filter.model.AssessmentFactor;
import java.util.List;

/** Score, reasoning and factors produced by one assessment stage. */
record StageResult(double score, String reasoning, List<AssessmentFactor> factors) {

  StageResult {
    factors = List.copyOf(factors);
  }
}
