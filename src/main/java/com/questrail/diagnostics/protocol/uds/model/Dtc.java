package com.questrail.diagnostics.protocol.uds.model;

import com.questrail.diagnostics.protocol.uds.UdsConfigurationException;

import java.util.Objects;

/**
 * Diagnostic Trouble Code with its ISO-14229 status byte.
 *
 * <h2>Status byte layout</h2>
 * <pre>
 *   bit 0  testFailed
 *   bit 1  testFailedThisOperationCycle
 *   bit 2  pending
 *   bit 3  confirmed
 *   bit 4  testNotCompletedSinceLastClear
 *   bit 5  testFailedSinceLastClear
 *   bit 6  testNotCompletedThisOperationCycle
 *   bit 7  warningIndicatorRequested
 * </pre>
 *
 * <p>The status bits are mutable: a DTC is updated as new reports for the
 * same code arrive from the vehicle. {@link Severity} is a separate
 * classification and is never packed into the status byte.</p>
 *
 * <p>This class makes no thread-safety guarantees.</p>
 */
public final class Dtc
{
    /** Largest DTC number (three bytes on the wire). */
    public static final int MAX_ID = 0xFFFFFF;

    static final int TEST_FAILED = 0x01;
    static final int TEST_FAILED_THIS_OPERATION_CYCLE = 0x02;
    static final int PENDING = 0x04;
    static final int CONFIRMED = 0x08;
    static final int TEST_NOT_COMPLETED_SINCE_LAST_CLEAR = 0x10;
    static final int TEST_FAILED_SINCE_LAST_CLEAR = 0x20;
    static final int TEST_NOT_COMPLETED_THIS_OPERATION_CYCLE = 0x40;
    static final int WARNING_INDICATOR_REQUESTED = 0x80;

    /**
     * DTC severity classes as reported by ReadDTCInformation.
     */
    public enum Severity {
        NOT_AVAILABLE(0),
        MAINTENANCE_ONLY(1),
        CHECK_AT_NEXT_HALT(2),
        CHECK_IMMEDIATELY(4);

        private final int value;

        Severity(int value) {
            this.value = value;
        }

        public int value() {
            return value;
        }

        public static Severity fromValue(int value) {
            for (Severity s : values()) {
                if (s.value == value) {
                    return s;
                }
            }
            throw new UdsConfigurationException("Unknown DTC severity: " + value);
        }
    }

    private final int id;
    private Severity severity = Severity.NOT_AVAILABLE;

    private boolean testFailed;
    private boolean testFailedThisOperationCycle;
    private boolean pending;
    private boolean confirmed;
    private boolean testNotCompletedSinceLastClear;
    private boolean testFailedSinceLastClear;
    private boolean testNotCompletedThisOperationCycle;
    private boolean warningIndicatorRequested;

    /**
     * @param id DTC number (0x000000–0xFFFFFF)
     */
    public Dtc(int id) {
        if (id < 0 || id > MAX_ID) {
            throw new UdsConfigurationException("DTC id must be in range 0x000000–0xFFFFFF (was " + id + ")");
        }
        this.id = id;
    }

    public int id() {
        return id;
    }

    public Severity severity() {
        return severity;
    }

    public void setSeverity(Severity severity) {
        this.severity = Objects.requireNonNull(severity, "severity");
    }

    /**
     * Packs the eight status flags into the status byte.
     */
    public int getStatus() {
        int status = 0;
        status |= testFailed ? TEST_FAILED : 0;
        status |= testFailedThisOperationCycle ? TEST_FAILED_THIS_OPERATION_CYCLE : 0;
        status |= pending ? PENDING : 0;
        status |= confirmed ? CONFIRMED : 0;
        status |= testNotCompletedSinceLastClear ? TEST_NOT_COMPLETED_SINCE_LAST_CLEAR : 0;
        status |= testFailedSinceLastClear ? TEST_FAILED_SINCE_LAST_CLEAR : 0;
        status |= testNotCompletedThisOperationCycle ? TEST_NOT_COMPLETED_THIS_OPERATION_CYCLE : 0;
        status |= warningIndicatorRequested ? WARNING_INDICATOR_REQUESTED : 0;
        return status;
    }

    /**
     * Overwrites all eight flags from a status byte. Bits above bit 7 are ignored.
     */
    public void setStatus(int status) {
        testFailed = (status & TEST_FAILED) != 0;
        testFailedThisOperationCycle = (status & TEST_FAILED_THIS_OPERATION_CYCLE) != 0;
        pending = (status & PENDING) != 0;
        confirmed = (status & CONFIRMED) != 0;
        testNotCompletedSinceLastClear = (status & TEST_NOT_COMPLETED_SINCE_LAST_CLEAR) != 0;
        testFailedSinceLastClear = (status & TEST_FAILED_SINCE_LAST_CLEAR) != 0;
        testNotCompletedThisOperationCycle = (status & TEST_NOT_COMPLETED_THIS_OPERATION_CYCLE) != 0;
        warningIndicatorRequested = (status & WARNING_INDICATOR_REQUESTED) != 0;
    }

    /**
     * Applies only the flags present in {@code update}; the others keep their value.
     */
    public void updateStatus(StatusUpdate update) {
        Objects.requireNonNull(update, "update");
        if (update.testFailed != null) {
            testFailed = update.testFailed;
        }
        if (update.testFailedThisOperationCycle != null) {
            testFailedThisOperationCycle = update.testFailedThisOperationCycle;
        }
        if (update.pending != null) {
            pending = update.pending;
        }
        if (update.confirmed != null) {
            confirmed = update.confirmed;
        }
        if (update.testNotCompletedSinceLastClear != null) {
            testNotCompletedSinceLastClear = update.testNotCompletedSinceLastClear;
        }
        if (update.testFailedSinceLastClear != null) {
            testFailedSinceLastClear = update.testFailedSinceLastClear;
        }
        if (update.testNotCompletedThisOperationCycle != null) {
            testNotCompletedThisOperationCycle = update.testNotCompletedThisOperationCycle;
        }
        if (update.warningIndicatorRequested != null) {
            warningIndicatorRequested = update.warningIndicatorRequested;
        }
    }

    public boolean testFailed() {
        return testFailed;
    }

    public boolean testFailedThisOperationCycle() {
        return testFailedThisOperationCycle;
    }

    public boolean pending() {
        return pending;
    }

    public boolean confirmed() {
        return confirmed;
    }

    public boolean testNotCompletedSinceLastClear() {
        return testNotCompletedSinceLastClear;
    }

    public boolean testFailedSinceLastClear() {
        return testFailedSinceLastClear;
    }

    public boolean testNotCompletedThisOperationCycle() {
        return testNotCompletedThisOperationCycle;
    }

    public boolean warningIndicatorRequested() {
        return warningIndicatorRequested;
    }

    @Override
    public String toString() {
        return String.format("Dtc[0x%06X, status=0x%02X, severity=%s]", id, getStatus(), severity);
    }

    /**
     * Partial status update. Flags left unset are not touched.
     */
    public static final class StatusUpdate {
        private Boolean testFailed;
        private Boolean testFailedThisOperationCycle;
        private Boolean pending;
        private Boolean confirmed;
        private Boolean testNotCompletedSinceLastClear;
        private Boolean testFailedSinceLastClear;
        private Boolean testNotCompletedThisOperationCycle;
        private Boolean warningIndicatorRequested;

        public StatusUpdate testFailed(boolean value) {
            this.testFailed = value;
            return this;
        }

        public StatusUpdate testFailedThisOperationCycle(boolean value) {
            this.testFailedThisOperationCycle = value;
            return this;
        }

        public StatusUpdate pending(boolean value) {
            this.pending = value;
            return this;
        }

        public StatusUpdate confirmed(boolean value) {
            this.confirmed = value;
            return this;
        }

        public StatusUpdate testNotCompletedSinceLastClear(boolean value) {
            this.testNotCompletedSinceLastClear = value;
            return this;
        }

        public StatusUpdate testFailedSinceLastClear(boolean value) {
            this.testFailedSinceLastClear = value;
            return this;
        }

        public StatusUpdate testNotCompletedThisOperationCycle(boolean value) {
            this.testNotCompletedThisOperationCycle = value;
            return this;
        }

        public StatusUpdate warningIndicatorRequested(boolean value) {
            this.warningIndicatorRequested = value;
            return this;
        }
    }
}
