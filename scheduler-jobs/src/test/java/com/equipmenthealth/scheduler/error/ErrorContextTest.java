package com.equipmenthealth.scheduler.error;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ErrorContextTest {

    @Test
    void messageCarriesEveryKnownLocator() {
        ErrorContext context = ErrorContext.execution(
                "pump-scheduler", Instant.parse("2021-01-27T09:15:00Z"), "pump/results.jsonl");

        MalformedResultException ex = new MalformedResultException("Record 3 is invalid", context);

        assertEquals("Record 3 is invalid [schedule=pump-scheduler, fireTime=2021-01-27T09:15:00Z, key=pump/results.jsonl]",
                ex.getMessage());
        assertSame(context, ex.context());
    }

    @Test
    void emptyContextLeavesMessageAlone() {
        InvalidConfigurationException ex = new InvalidConfigurationException("bad", ErrorContext.NONE);

        assertEquals("bad", ex.getMessage());
        assertTrue(ex.context().isEmpty());
    }

    @Test
    void failureClassesAreDistinct() {
        assertEquals("ALREADY_EXISTS", new AlreadyExistsException("x", ErrorContext.NONE).failureClass());
        assertEquals("INVALID_STATE", new InvalidStateException("x", ErrorContext.NONE).failureClass());
        assertEquals("INCONSISTENT_TIMELINE", new InconsistentTimelineException("x", ErrorContext.NONE).failureClass());
        assertEquals("TRANSPORT_FAILURE",
                new TransportFailureException("GetObject", ErrorContext.NONE, null).failureClass());
    }
}
