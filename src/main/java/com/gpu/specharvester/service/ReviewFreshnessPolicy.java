package com.gpu.specharvester.service;

import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Incremental update rule: a stored review is refreshed when it was never stamped, or when its
 * last update happened on a calendar day before the posting date found on the page.
 */
@Component
public class ReviewFreshnessPolicy {

    public boolean needsUpdate(LocalDateTime storedUpdatedAt, LocalDate postedDate) {
        if (storedUpdatedAt == null) {
            return true;
        }
        if (postedDate == null) {
            return false;
        }
        return storedUpdatedAt.toLocalDate().isBefore(postedDate);
    }
}
