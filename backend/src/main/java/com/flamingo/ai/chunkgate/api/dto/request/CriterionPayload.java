package com.flamingo.ai.chunkgate.api.dto.request;

import com.flamingo.ai.chunkgate.domain.enums.CriterionType;
import com.flamingo.ai.chunkgate.service.filter.model.FilterCriterion;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for a filter criterion. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CriterionPayload {

  @NotNull(message = "Criterion type is required")
  private CriterionType type;

  /** Keyword or list of keywords for KEYWORD_PRESENCE; ignored by the other types. */
  private Object value;

  @Builder.Default private Double weight = 1.0;

  @Builder.Default private boolean mandatory = false;

  public FilterCriterion toCriterion() {
    return new FilterCriterion(type, value, weight == null ? 1.0 : weight, mandatory);
  }
}
