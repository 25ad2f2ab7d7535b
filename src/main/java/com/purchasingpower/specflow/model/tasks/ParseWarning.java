package com.purchasingpower.specflow.model.tasks;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * Non-fatal parse problem. Parsing always continues after one is recorded.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ParseWarning {
    WarningType type;
    String message;
    Integer lineNumber;
}
