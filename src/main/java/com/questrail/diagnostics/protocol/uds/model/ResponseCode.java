package com.questrail.diagnostics.protocol.uds.model;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Response codes defined by ISO-14229, plus the ISO-15764 security block.
 *
 * <p>{@link #POSITIVE_RESPONSE} (0x00) is a sentinel meaning "no error"; every
 * other constant is a negative response code (NRC) carried after the
 * {@code 0x7F} marker. The ISO-15764 codes sit at the fixed offset
 * {@value #SECURITY_BLOCK_OFFSET} inside the UDS code space.</p>
 */
public enum ResponseCode
{
    POSITIVE_RESPONSE(0x00, "PositiveResponse"),
    GENERAL_REJECT(0x10, "GeneralReject"),
    SERVICE_NOT_SUPPORTED(0x11, "ServiceNotSupported"),
    SUB_FUNCTION_NOT_SUPPORTED(0x12, "SubFunctionNotSupported"),
    INCORRECT_MESSAGE_LENGTH_OR_INVALID_FORMAT(0x13, "IncorrectMessageLengthOrInvalidFormat"),
    RESPONSE_TOO_LONG(0x14, "ResponseTooLong"),
    BUSY_REPEAT_REQUEST(0x21, "BusyRepeatRequest"),
    CONDITIONS_NOT_CORRECT(0x22, "ConditionsNotCorrect"),
    REQUEST_SEQUENCE_ERROR(0x24, "RequestSequenceError"),
    NO_RESPONSE_FROM_SUBNET_COMPONENT(0x25, "NoResponseFromSubnetComponent"),
    FAILURE_PREVENTS_EXECUTION_OF_REQUESTED_ACTION(0x26, "FailurePreventsExecutionOfRequestedAction"),
    REQUEST_OUT_OF_RANGE(0x31, "RequestOutOfRange"),
    SECURITY_ACCESS_DENIED(0x33, "SecurityAccessDenied"),
    INVALID_KEY(0x35, "InvalidKey"),
    EXCEED_NUMBER_OF_ATTEMPTS(0x36, "ExceedNumberOfAttempts"),
    REQUIRED_TIME_DELAY_NOT_EXPIRED(0x37, "RequiredTimeDelayNotExpired"),

    // ISO-15764 extended data link security
    GENERAL_SECURITY_VIOLATION(SecurityBlock.OFFSET, "GeneralSecurityViolation"),
    SECURED_MODE_REQUESTED(SecurityBlock.OFFSET + 1, "SecuredModeRequested"),
    INSUFFICIENT_PROTECTION(SecurityBlock.OFFSET + 2, "InsufficientProtection"),
    TERMINATION_WITH_SIGNATURE_REQUESTED(SecurityBlock.OFFSET + 3, "TerminationWithSignatureRequested"),
    ACCESS_DENIED(SecurityBlock.OFFSET + 4, "AccessDenied"),
    VERSION_NOT_SUPPORTED(SecurityBlock.OFFSET + 5, "VersionNotSupported"),
    SECURED_LINK_NOT_SUPPORTED(SecurityBlock.OFFSET + 6, "SecuredLinkNotSupported"),
    CERTIFICATE_NOT_AVAILABLE(SecurityBlock.OFFSET + 7, "CertificateNotAvailable"),
    AUDIT_TRAIL_INFORMATION_NOT_AVAILABLE(SecurityBlock.OFFSET + 8, "AuditTrailInformationNotAvailable"),

    UPLOAD_DOWNLOAD_NOT_ACCEPTED(0x70, "UploadDownloadNotAccepted"),
    TRANSFER_DATA_SUSPENDED(0x71, "TransferDataSuspended"),
    GENERAL_PROGRAMMING_FAILURE(0x72, "GeneralProgrammingFailure"),
    WRONG_BLOCK_SEQUENCE_COUNTER(0x73, "WrongBlockSequenceCounter"),
    REQUEST_CORRECTLY_RECEIVED_RESPONSE_PENDING(0x78, "RequestCorrectlyReceived_ResponsePending"),
    SUB_FUNCTION_NOT_SUPPORTED_IN_ACTIVE_SESSION(0x7E, "SubFunctionNotSupportedInActiveSession"),
    SERVICE_NOT_SUPPORTED_IN_ACTIVE_SESSION(0x7F, "ServiceNotSupportedInActiveSession"),
    RPM_TOO_HIGH(0x81, "RpmTooHigh"),
    RPM_TOO_LOW(0x82, "RpmTooLow"),
    ENGINE_IS_RUNNING(0x83, "EngineIsRunning"),
    ENGINE_IS_NOT_RUNNING(0x84, "EngineIsNotRunning"),
    ENGINE_RUN_TIME_TOO_LOW(0x85, "EngineRunTimeTooLow"),
    TEMPERATURE_TOO_HIGH(0x86, "TemperatureTooHigh"),
    TEMPERATURE_TOO_LOW(0x87, "TemperatureTooLow"),
    VEHICLE_SPEED_TOO_HIGH(0x88, "VehicleSpeedTooHigh"),
    VEHICLE_SPEED_TOO_LOW(0x89, "VehicleSpeedTooLow"),
    THROTTLE_PEDAL_TOO_HIGH(0x8A, "ThrottlePedalTooHigh"),
    THROTTLE_PEDAL_TOO_LOW(0x8B, "ThrottlePedalTooLow"),
    TRANSMISSION_RANGE_NOT_IN_NEUTRAL(0x8C, "TransmissionRangeNotInNeutral"),
    TRANSMISSION_RANGE_NOT_IN_GEAR(0x8D, "TransmissionRangeNotInGear"),
    ISO_SAE_RESERVED(0x8E, "ISOSAEReserved"),
    BRAKE_SWITCH_NOT_CLOSED(0x8F, "BrakeSwitchNotClosed"),
    SHIFTER_LEVER_NOT_IN_PARK(0x90, "ShifterLeverNotInPark"),
    TORQUE_CONVERTER_CLUTCH_LOCKED(0x91, "TorqueConverterClutchLocked"),
    VOLTAGE_TOO_HIGH(0x92, "VoltageTooHigh"),
    VOLTAGE_TOO_LOW(0x93, "VoltageTooLow");

    /**
     * Start of the ISO-15764 block within the UDS response code space.
     */
    public static final int SECURITY_BLOCK_OFFSET = SecurityBlock.OFFSET;

    private static final Map<Integer, ResponseCode> BY_VALUE = new HashMap<>();

    static {
        for (ResponseCode code : values()) {
            BY_VALUE.put(code.value, code);
        }
    }

    private final int value;
    private final String symbolicName;

    ResponseCode(int value, String symbolicName) {
        this.value = value;
        this.symbolicName = symbolicName;
    }

    public int value() {
        return value;
    }

    /**
     * The name used in logs and diagnostics, e.g. {@code RequestOutOfRange}.
     */
    public String symbolicName() {
        return symbolicName;
    }

    public static Optional<ResponseCode> fromValue(int value) {
        return Optional.ofNullable(BY_VALUE.get(value));
    }

    /**
     * Returns a printable name for {@code code}.
     *
     * @return {@code ""} for {@code null}, the symbolic name of a registered
     *         code, otherwise the decimal value
     */
    public static String nameOf(Integer code) {
        if (code == null) {
            return "";
        }
        ResponseCode known = BY_VALUE.get(code);
        return known != null ? known.symbolicName : String.valueOf(code);
    }

    /**
     * Tells whether {@code code} is a registered negative response code.
     *
     * <p>Unregistered values are reported as not negative.</p>
     */
    public static boolean isNegative(Integer code) {
        if (code == null || code == POSITIVE_RESPONSE.value) {
            return false;
        }
        return BY_VALUE.containsKey(code);
    }

    // Enum constants cannot reference a static field of their own enum.
    private static final class SecurityBlock {
        static final int OFFSET = 0x38;
    }
}
