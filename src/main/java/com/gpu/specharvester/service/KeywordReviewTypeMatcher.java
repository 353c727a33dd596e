package com.gpu.specharvester.service;

import com.gpu.specharvester.config.HarvesterProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Rule table driven matcher.
 * <p>
 * A review type containing a rule key accepts any option whose text contains one of that rule's
 * keywords. Types without a rule fall back to plain containment in either direction.
 */
@Component
@RequiredArgsConstructor
public class KeywordReviewTypeMatcher implements ReviewTypeMatcher {

    private final HarvesterProperties properties;

    @Override
    public boolean matches(String reviewType, String optionText) {
        if (reviewType == null || optionText == null || reviewType.isBlank() || optionText.isBlank()) {
            return false;
        }
        String type = reviewType.toLowerCase(Locale.ROOT).trim();
        String option = optionText.toLowerCase(Locale.ROOT).trim();

        for (Map.Entry<String, List<String>> rule : properties.getReviewTypeRules().entrySet()) {
            if (type.contains(rule.getKey().toLowerCase(Locale.ROOT))) {
                return rule.getValue().stream()
                        .map(keyword -> keyword.toLowerCase(Locale.ROOT))
                        .anyMatch(option::contains);
            }
        }
        return type.contains(option) || option.contains(type);
    }
}
