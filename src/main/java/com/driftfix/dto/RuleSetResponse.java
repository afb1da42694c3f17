package com.driftfix.dto;

import com.driftfix.domain.PreprocessingRuleSet;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RuleSetResponse {
    String modelId;
    PreprocessingRuleSet ruleSet;
    boolean canRollBack;
}
