package com.campusfeedback.backend.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class FormLifecycleScheduler {

    private final FeedbackFormService feedbackFormService;

    @Scheduled(cron = "${feedback.forms.close-cron:0 0 * * * *}")
    public void closeExpiredForms() {
        try {
            int closed = feedbackFormService.closeExpiredForms();
            log.debug("[Scheduler] form expiration run finished, {} closed", closed);
        } catch (RuntimeException e) {
            log.error("[Scheduler] Error closing expired feedback forms", e);
        }
    }
}
