package com.gpu.specharvester.dto;

import com.gpu.specharvester.service.RunMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Final summary of a harvest run, produced on success and on failure
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunSummary {

    private RunMode mode;

    /**
     * GPU name filter of a default run, null when the whole catalog was crawled
     */
    private String target;

    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private double elapsedSeconds;

    private int products;
    private int boards;
    private int specs;
    private int reviews;

    /**
     * Reviews rewritten by a full or incremental reconciliation
     */
    private int updatedReviews;

    private int errors;

    private boolean success;

    /**
     * Text of the error that ended the run, null on success
     */
    private String error;
}
