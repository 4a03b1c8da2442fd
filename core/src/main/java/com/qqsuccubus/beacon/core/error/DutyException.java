package com.qqsuccubus.beacon.core.error;

import lombok.Getter;

import java.util.OptionalLong;

/**
 * Failure raised by duty computation, request handling and streaming.
 * <p>
 * The {@link ErrorKind} decides how the failure propagates:
 * <ul>
 *   <li>{@code INVALID_REQUEST}, {@code NOT_FOUND}: terminal for one call, never for a live stream</li>
 *   <li>{@code COMPUTATION_FAILURE}: skips one epoch of a stream unless {@link #isStructural()}</li>
 *   <li>{@code UNAVAILABLE}, {@code CANCELED}, {@code ABORTED}: end the stream</li>
 * </ul>
 * </p>
 */
@Getter
public class DutyException extends RuntimeException {

    public enum ErrorKind {
        INVALID_REQUEST(400, 1008),
        NOT_FOUND(404, 1008),
        COMPUTATION_FAILURE(500, 1011),
        UNAVAILABLE(503, 1011),
        CANCELED(499, 1001),
        ABORTED(500, 1011);

        @Getter
        private final int httpStatus;
        @Getter
        private final int closeCode;

        ErrorKind(int httpStatus, int closeCode) {
            this.httpStatus = httpStatus;
            this.closeCode = closeCode;
        }
    }

    private final ErrorKind kind;
    private final boolean structural;
    private final Long slot;

    public DutyException(ErrorKind kind, String message, Long slot, boolean structural, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.slot = slot;
        this.structural = structural;
    }

    public static DutyException invalidRequest(String message) {
        return new DutyException(ErrorKind.INVALID_REQUEST, message, null, false, null);
    }

    public static DutyException notFound(String message) {
        return new DutyException(ErrorKind.NOT_FOUND, message, null, false, null);
    }

    public static DutyException computationFailure(long slot, String message, Throwable cause) {
        return new DutyException(ErrorKind.COMPUTATION_FAILURE, message, slot, false, cause);
    }

    /**
     * Computation produced a result that cannot be right (for example a wrong proposer count), so the
     * state it was derived from is not to be trusted.
     */
    public static DutyException structuralFailure(String message) {
        return new DutyException(ErrorKind.COMPUTATION_FAILURE, message, null, true, null);
    }

    public static DutyException unavailable(String message, Throwable cause) {
        return new DutyException(ErrorKind.UNAVAILABLE, message, null, false, cause);
    }

    public static DutyException canceled(String message) {
        return new DutyException(ErrorKind.CANCELED, message, null, false, null);
    }

    public static DutyException canceled(String message, Throwable cause) {
        return new DutyException(ErrorKind.CANCELED, message, null, false, cause);
    }

    public static DutyException aborted(String message) {
        return new DutyException(ErrorKind.ABORTED, message, null, false, null);
    }

    public OptionalLong slotTag() {
        return slot != null ? OptionalLong.of(slot) : OptionalLong.empty();
    }

    /**
     * Whether a live stream may skip this failure and carry on with the next epoch.
     */
    public boolean isSkippable() {
        return switch (kind) {
            case INVALID_REQUEST, NOT_FOUND -> true;
            case COMPUTATION_FAILURE -> !structural;
            default -> false;
        };
    }

    @Override
    public String toString() {
        return "DutyException{" + kind + (slot != null ? " slot=" + slot : "") + ": " + getMessage() + "}";
    }
}
