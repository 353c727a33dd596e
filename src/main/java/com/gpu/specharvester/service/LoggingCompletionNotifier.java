package com.gpu.specharvester.service;

import com.gpu.specharvester.config.HarvesterProperties;
import com.gpu.specharvester.dto.RunSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Renders the run summary as a plain-text message for the configured operators and writes it to the log
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LoggingCompletionNotifier implements CompletionNotifier {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final HarvesterProperties properties;

    @Override
    public void runCompleted(RunSummary summary) {
        String subject = "GPU harvest (" + summary.getMode().label() + ") "
                + (summary.isSuccess() ? "completed" : "failed");
        log.info("Notification from {} to {}\nSubject: {}\n\n{}",
                properties.getNotification().getSender(),
                properties.getNotification().getRecipients(),
                subject,
                render(summary));
    }

    String render(RunSummary summary) {
        StringBuilder text = new StringBuilder();
        text.append("Mode: ").append(summary.getMode().label()).append('\n');
        if (summary.getTarget() != null) {
            text.append("GPU: ").append(summary.getTarget()).append('\n');
        }
        text.append("Started: ").append(format(summary.getStartedAt())).append('\n');
        text.append("Finished: ").append(format(summary.getCompletedAt())).append('\n');
        text.append(String.format("Elapsed: %.1f s%n", summary.getElapsedSeconds()));
        text.append("Products: ").append(summary.getProducts()).append('\n');
        text.append("Boards: ").append(summary.getBoards()).append('\n');
        text.append("Specs: ").append(summary.getSpecs()).append('\n');
        text.append("Reviews: ").append(summary.getReviews()).append('\n');
        text.append("Updated reviews: ").append(summary.getUpdatedReviews()).append('\n');
        text.append("Errors: ").append(summary.getErrors()).append('\n');
        text.append("Status: ").append(summary.isSuccess() ? "success" : "failed").append('\n');
        if (summary.getError() != null) {
            text.append("Error: ").append(summary.getError()).append('\n');
        }
        return text.toString();
    }

    private static String format(LocalDateTime time) {
        return time == null ? "-" : TIME_FORMAT.format(time);
    }
}
