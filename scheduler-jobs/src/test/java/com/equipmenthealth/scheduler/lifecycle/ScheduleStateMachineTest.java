package com.equipmenthealth.scheduler.lifecycle;

import com.equipmenthealth.scheduler.error.AlreadyExistsException;
import com.equipmenthealth.scheduler.error.InvalidStateException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleStateMachineTest {

    @Test
    void followsTheDocumentedEdges() {
        assertEquals(ScheduleState.RUNNING, ScheduleStateMachine.next(ScheduleState.UNCREATED, ScheduleAction.CREATE, "s"));
        assertEquals(ScheduleState.STOPPED, ScheduleStateMachine.next(ScheduleState.RUNNING, ScheduleAction.STOP, "s"));
        assertEquals(ScheduleState.RUNNING, ScheduleStateMachine.next(ScheduleState.STOPPED, ScheduleAction.START, "s"));
        assertEquals(ScheduleState.DELETED, ScheduleStateMachine.next(ScheduleState.STOPPED, ScheduleAction.DELETE, "s"));
    }

    @Test
    void createOnLiveScheduleIsAlreadyExists() {
        assertThrows(AlreadyExistsException.class,
                () -> ScheduleStateMachine.next(ScheduleState.RUNNING, ScheduleAction.CREATE, "s"));
        assertThrows(AlreadyExistsException.class,
                () -> ScheduleStateMachine.next(ScheduleState.STOPPED, ScheduleAction.CREATE, "s"));
    }

    @Test
    void deleteWhileRunningIsInvalidState() {
        InvalidStateException ex = assertThrows(InvalidStateException.class,
                () -> ScheduleStateMachine.next(ScheduleState.RUNNING, ScheduleAction.DELETE, "pump-scheduler"));
        assertEquals("pump-scheduler", ex.context().scheduleName());
        assertTrue(ex.getMessage().contains("schedule=pump-scheduler"));
    }

    @Test
    void everyUnlistedEdgeIsInvalidState() {
        assertThrows(InvalidStateException.class,
                () -> ScheduleStateMachine.next(ScheduleState.UNCREATED, ScheduleAction.STOP, "s"));
        assertThrows(InvalidStateException.class,
                () -> ScheduleStateMachine.next(ScheduleState.UNCREATED, ScheduleAction.START, "s"));
        assertThrows(InvalidStateException.class,
                () -> ScheduleStateMachine.next(ScheduleState.UNCREATED, ScheduleAction.DELETE, "s"));
        assertThrows(InvalidStateException.class,
                () -> ScheduleStateMachine.next(ScheduleState.RUNNING, ScheduleAction.START, "s"));
        assertThrows(InvalidStateException.class,
                () -> ScheduleStateMachine.next(ScheduleState.STOPPED, ScheduleAction.STOP, "s"));
        for (ScheduleAction action : ScheduleAction.values()) {
            assertThrows(InvalidStateException.class,
                    () -> ScheduleStateMachine.next(ScheduleState.DELETED, action, "s"), action.name());
        }
    }
}
