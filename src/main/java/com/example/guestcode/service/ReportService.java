package com.example.guestcode.service;

import com.example.guestcode.model.RunOutcome;
import com.example.guestcode.service.util.Msg;
import com.example.guestcode.service.util.WindowFormat;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;

/**
 * Sends the summary of a pass to every configured sink. Delivery problems are
 * logged and never change the outcome of the pass.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReportService {

    private final List<ReportSink> sinks;
    private final Msg msg;

    @Value("${report.subject-prefix}")
    private String subjectPrefix;

    public String subject(RunOutcome outcome, LocalDate runDate) {
        String key = outcome.hadError() ? "report.subject.failed" : "report.subject.ok";
        return msg.get(key, subjectPrefix, WindowFormat.LOCAL_DATE.format(runDate));
    }

    public String body(RunOutcome outcome) {
        return outcome.summaryLines().isEmpty() ? msg.get("report.empty") : outcome.body();
    }

    public void send(RunOutcome outcome, LocalDate runDate) {
        String subject = subject(outcome, runDate);
        if (sinks.isEmpty()) {
            log.info("No report sink configured, '{}' not sent", subject);
            return;
        }
        String body = body(outcome);
        for (ReportSink sink : sinks) {
            try {
                sink.deliver(subject, body);
            } catch (Exception e) {
                log.error("[ERR] Report delivery via {} failed: {}", sink.name(), e.getMessage());
            }
        }
    }
}
