package com.detour.model.dto;

import com.detour.model.MockRule;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Admin view of a registered mock rule.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MockRuleSummary {

    private int position;
    private String name;
    private String method;
    private String url;

    public static MockRuleSummary from(int position, MockRule rule) {
        return MockRuleSummary.builder()
                .position(position)
                .name(rule.describe())
                .method(rule.getMethod())
                .url(rule.getUrl().toString())
                .build();
    }
}
