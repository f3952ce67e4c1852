package com.project.recall.backend.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Envelope of every JSON body the service returns: a human readable message and, for
 * successful calls and validation errors, a payload.
 */
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse {
    String message;
    Object mainBody;

    public ApiResponse(String message) {
        this.message = message;
    }

    public ApiResponse(ResponseMessage responseMessage) {
        this(responseMessage.toString());
    }

    public ApiResponse(ResponseMessage responseMessage, Object mainBody) {
        this(responseMessage.toString(), mainBody);
    }
}
