package com.ai.intake.dto;

import lombok.Value;

/**
 * A function call requested by the model. Arguments stay as the raw JSON
 * string the model produced.
 */
@Value
public class ModelToolCall {

    String id;
    String name;
    String argumentsJson;
}
