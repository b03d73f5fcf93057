package com.example.liveview.shared.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.ZonedDateTime;

/**
 * Body of non-plain-text error responses from the live endpoint.
 * {@code contextId} is the raw {@code id} query parameter, omitted when the request had none.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    ZonedDateTime timestamp;
    int status;
    String error;
    String message;
    String path;
    String contextId;
}
