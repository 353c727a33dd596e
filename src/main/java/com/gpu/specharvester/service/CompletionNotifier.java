package com.gpu.specharvester.service;

import com.gpu.specharvester.dto.RunSummary;

/**
 * Receives the final summary of every run, successful or not
 */
public interface CompletionNotifier {

    void runCompleted(RunSummary summary);
}
