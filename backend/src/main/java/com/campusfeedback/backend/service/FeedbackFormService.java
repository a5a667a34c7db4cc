package com.campusfeedback.backend.service;

import com.campusfeedback.backend.entity.FormStatus;
import com.campusfeedback.backend.repository.FeedbackFormRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

@Service
@RequiredArgsConstructor
@Slf4j
public class FeedbackFormService {

    private final FeedbackFormRepository feedbackFormRepository;
    private final Clock clock;

    /**
     * Moves every active, non-deleted form whose end date lies in the past to CLOSED.
     *
     * @return number of forms closed
     */
    @Transactional
    public int closeExpiredForms() {
        int closed = feedbackFormRepository.closeExpired(FormStatus.ACTIVE, FormStatus.CLOSED, LocalDateTime.now(clock));
        if (closed > 0) {
            log.info("Closed {} feedback forms past their end date", closed);
        }
        return closed;
    }
}
