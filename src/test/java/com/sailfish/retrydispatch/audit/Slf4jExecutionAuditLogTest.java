package com.sailfish.retrydispatch.audit;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.sailfish.retrydispatch.model.ExecutionRecord;
import com.sailfish.retrydispatch.worker.CalloutExchange;
import com.sailfish.retrydispatch.worker.WorkerContext;
import com.sailfish.retrydispatch.worker.WorkerExecutionException;
import com.sailfish.retrydispatch.worker.WorkerOutcome;

import java.util.Arrays;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static com.sailfish.retrydispatch.RecordFixtures.failedExecution;
import static com.sailfish.retrydispatch.RecordFixtures.policy;
import static org.assertj.core.api.Assertions.assertThat;

class Slf4jExecutionAuditLogTest {

    private Logger auditLogger;
    private Level previousLevel;
    private ListAppender<ILoggingEvent> appender;
    private Slf4jExecutionAuditLog auditLog;
    private WorkerContext context;

    @BeforeEach
    void setUp() {
        auditLogger = (Logger) LoggerFactory.getLogger(Slf4jExecutionAuditLog.AUDIT_LOGGER_NAME);
        previousLevel = auditLogger.getLevel();
        auditLogger.setLevel(Level.DEBUG);
        appender = new ListAppender<>();
        appender.start();
        auditLogger.addAppender(appender);

        auditLog = new Slf4jExecutionAuditLog();
        ExecutionRecord parent = failedExecution(12L, policy(1L, "orders", "orderExport"), "A", "B");
        ExecutionRecord child = ExecutionRecord.newRetryChild(parent);
        child.setId(40L);
        context = WorkerContext.retry("orderExport", child, parent.getRetryIds(), parent);
    }

    @AfterEach
    void tearDown() {
        auditLogger.detachAppender(appender);
        auditLogger.setLevel(previousLevel);
    }

    @Test
    void successfulExchangeIsLoggedWithPayloads() {
        auditLog.recordExchange(context, "A", CalloutExchange.success("{\"id\":\"A\"}", "{\"ok\":true}", 201));

        assertThat(appender.list).hasSize(2);
        assertThat(appender.list.get(0).getLevel()).isEqualTo(Level.INFO);
        assertThat(appender.list.get(0).getFormattedMessage())
                .contains("execution=40", "mode=RETRY", "record=A", "status=201", "outcome=SUCCESS");
        assertThat(appender.list.get(1).getLevel()).isEqualTo(Level.DEBUG);
        assertThat(appender.list.get(1).getFormattedMessage()).contains("{\"ok\":true}");
    }

    @Test
    void failedExchangeIsAWarning() {
        auditLog.recordExchange(context, "B", CalloutExchange.failure("{}", "busy", 503, "Service unavailable"));

        assertThat(appender.list.get(0).getLevel()).isEqualTo(Level.WARN);
        assertThat(appender.list.get(0).getFormattedMessage()).contains("outcome=FAILURE", "Service unavailable");
    }

    @Test
    void longPayloadsAreTruncated() {
        char[] body = new char[5_000];
        Arrays.fill(body, 'x');

        auditLog.recordExchange(context, "A", CalloutExchange.success(new String(body), null, 200));

        assertThat(appender.list.get(1).getFormattedMessage().length()).isLessThan(2_200);
    }

    @Test
    void errorsAndCompletionAreRecorded() {
        auditLog.recordError(context, "A", new IllegalStateException("socket closed"));
        auditLog.recordWorkerFailure(context, new WorkerExecutionException(context, new IllegalStateException("no token")));
        auditLog.recordCompletion(context, WorkerOutcome.builder().succeeded("A", 200).failed("B", "timeout", null).build());

        assertThat(appender.list).extracting(ILoggingEvent::getLevel)
                .containsExactly(Level.ERROR, Level.ERROR, Level.INFO);
        assertThat(appender.list.get(0).getFormattedMessage()).contains("outcome=EXCEPTION", "socket closed");
        assertThat(appender.list.get(1).getFormattedMessage()).contains("outcome=WORKER_FAILURE", "no token");
        assertThat(appender.list.get(2).getFormattedMessage()).contains("parent=12", "succeeded=1", "failed=1");
    }
}
