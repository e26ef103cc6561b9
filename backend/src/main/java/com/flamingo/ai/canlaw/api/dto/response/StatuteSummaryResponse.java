package com.flamingo.ai.canlaw.api.dto.response;

import com.flamingo.ai.canlaw.service.statute.model.StatuteHierarchy;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** DTO describing a loaded Act and its node counts. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatuteSummaryResponse {
  private String actCode;
  private String actName;
  private String rootId;
  private Map<String, Integer> stats;

  public static StatuteSummaryResponse fromHierarchy(StatuteHierarchy hierarchy) {
    return StatuteSummaryResponse.builder()
        .actCode(hierarchy.getAct().actCode())
        .actName(hierarchy.getAct().actName())
        .rootId(hierarchy.getRootId())
        .stats(hierarchy.summaryStatistics())
        .build();
  }
}
