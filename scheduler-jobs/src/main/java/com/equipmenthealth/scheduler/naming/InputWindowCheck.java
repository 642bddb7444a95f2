package com.equipmenthealth.scheduler.naming;

import com.equipmenthealth.scheduler.model.ObjectRef;
import com.equipmenthealth.scheduler.model.TimeRange;

/**
 * Row counts of a staged input file against the window its run reads.
 */
public final class InputWindowCheck {
    public static final String NO_DATA_FOUND = "no data found";

    public final ObjectRef input;
    public final TimeRange window;
    public final long rowsInWindow;
    public final long rowsOutsideWindow;
    public final long unparsableRows;

    InputWindowCheck(ObjectRef input, TimeRange window, long rowsInWindow, long rowsOutsideWindow, long unparsableRows) {
        this.input = input;
        this.window = window;
        this.rowsInWindow = rowsInWindow;
        this.rowsOutsideWindow = rowsOutsideWindow;
        this.unparsableRows = unparsableRows;
    }

    public boolean hasData() {
        return rowsInWindow > 0;
    }

    /**
     * Reason the run would fail, or null when at least one row falls inside the window.
     */
    public String failureReason() {
        return hasData() ? null : NO_DATA_FOUND;
    }

    @Override
    public String toString() {
        return "InputWindowCheck{input=" + input + ", window=" + window + ", inWindow=" + rowsInWindow
                + ", outside=" + rowsOutsideWindow + ", unparsable=" + unparsableRows + "}";
    }
}
