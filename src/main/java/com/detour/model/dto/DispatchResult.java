package com.detour.model.dto;

import com.detour.model.Headers;
import com.detour.model.ResponseDescriptor;
import com.detour.model.ResponseSource;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * JSON form of a dispatched response.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DispatchResult {

    private int status;
    private String statusText;
    private Map<String, String> headers;
    private String body;
    private ResponseSource source;

    public static DispatchResult from(ResponseDescriptor response) {
        return DispatchResult.builder()
                .status(response.getStatus())
                .statusText(response.getStatusText())
                .headers(Headers.flatten(response.getHeaders()))
                .body(response.getBodyAsString())
                .source(response.getSource())
                .build();
    }
}
