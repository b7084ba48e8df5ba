package com.detour.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Registered interceptor names, in execution order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InterceptorSummary {
    private List<String> request;
    private List<String> response;
}
