package com.gpu.specharvester.dto;

import com.gpu.specharvester.service.RunMode;
import com.gpu.specharvester.service.RunState;

/**
 * Read-only snapshot of the run supervisor
 */
public record RunStatus(
        RunState state,
        boolean running,
        RunMode mode,
        String phase,
        int progress,
        RunSummary lastSummary
) {
}
