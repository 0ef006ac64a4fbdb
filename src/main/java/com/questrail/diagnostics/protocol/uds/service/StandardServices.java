package com.questrail.diagnostics.protocol.uds.service;

import java.util.List;

/**
 * Identity catalog of the ISO-14229 services.
 *
 * <p>Only wire identity is described here (IDs, subfunction byte, whether a
 * positive response carries data). Positive responses of subfunction
 * services echo the subfunction, so they are declared as carrying data.</p>
 */
public final class StandardServices
{
    public static final ServiceDescriptor DIAGNOSTIC_SESSION_CONTROL =
            ServiceDescriptor.of("DiagnosticSessionControl", 0x10, true, true);
    public static final ServiceDescriptor ECU_RESET =
            ServiceDescriptor.of("ECUReset", 0x11, true, true);
    public static final ServiceDescriptor CLEAR_DIAGNOSTIC_INFORMATION =
            ServiceDescriptor.of("ClearDiagnosticInformation", 0x14, false, false);
    public static final ServiceDescriptor READ_DTC_INFORMATION =
            ServiceDescriptor.of("ReadDTCInformation", 0x19, true, true);
    public static final ServiceDescriptor READ_DATA_BY_IDENTIFIER =
            ServiceDescriptor.of("ReadDataByIdentifier", 0x22, false, true);
    public static final ServiceDescriptor READ_MEMORY_BY_ADDRESS =
            ServiceDescriptor.of("ReadMemoryByAddress", 0x23, false, true);
    public static final ServiceDescriptor READ_SCALING_DATA_BY_IDENTIFIER =
            ServiceDescriptor.of("ReadScalingDataByIdentifier", 0x24, false, true);
    public static final ServiceDescriptor SECURITY_ACCESS =
            ServiceDescriptor.of("SecurityAccess", 0x27, true, true);
    public static final ServiceDescriptor COMMUNICATION_CONTROL =
            ServiceDescriptor.of("CommunicationControl", 0x28, true, true);
    public static final ServiceDescriptor READ_DATA_BY_PERIODIC_IDENTIFIER =
            ServiceDescriptor.of("ReadDataByPeriodicIdentifier", 0x2A, false, false);
    public static final ServiceDescriptor DYNAMICALLY_DEFINE_DATA_IDENTIFIER =
            ServiceDescriptor.of("DynamicallyDefineDataIdentifier", 0x2C, true, true);
    public static final ServiceDescriptor WRITE_DATA_BY_IDENTIFIER =
            ServiceDescriptor.of("WriteDataByIdentifier", 0x2E, false, true);
    public static final ServiceDescriptor INPUT_OUTPUT_CONTROL_BY_IDENTIFIER =
            ServiceDescriptor.of("InputOutputControlByIdentifier", 0x2F, false, true);
    public static final ServiceDescriptor ROUTINE_CONTROL =
            ServiceDescriptor.of("RoutineControl", 0x31, true, true);
    public static final ServiceDescriptor REQUEST_DOWNLOAD =
            ServiceDescriptor.of("RequestDownload", 0x34, false, true);
    public static final ServiceDescriptor REQUEST_UPLOAD =
            ServiceDescriptor.of("RequestUpload", 0x35, false, true);
    public static final ServiceDescriptor TRANSFER_DATA =
            ServiceDescriptor.of("TransferData", 0x36, false, true);
    public static final ServiceDescriptor REQUEST_TRANSFER_EXIT =
            ServiceDescriptor.of("RequestTransferExit", 0x37, false, true);
    public static final ServiceDescriptor WRITE_MEMORY_BY_ADDRESS =
            ServiceDescriptor.of("WriteMemoryByAddress", 0x3D, false, true);
    public static final ServiceDescriptor TESTER_PRESENT =
            ServiceDescriptor.of("TesterPresent", 0x3E, true, true);
    public static final ServiceDescriptor ACCESS_TIMING_PARAMETER =
            ServiceDescriptor.of("AccessTimingParameter", 0x83, true, true);
    public static final ServiceDescriptor SECURED_DATA_TRANSMISSION =
            ServiceDescriptor.of("SecuredDataTransmission", 0x84, false, true);
    public static final ServiceDescriptor CONTROL_DTC_SETTING =
            ServiceDescriptor.of("ControlDTCSetting", 0x85, true, true);
    public static final ServiceDescriptor RESPONSE_ON_EVENT =
            ServiceDescriptor.of("ResponseOnEvent", 0x86, true, true);
    public static final ServiceDescriptor LINK_CONTROL =
            ServiceDescriptor.of("LinkControl", 0x87, true, true);

    private static final List<ServiceDescriptor> ALL = List.of(
            DIAGNOSTIC_SESSION_CONTROL,
            ECU_RESET,
            CLEAR_DIAGNOSTIC_INFORMATION,
            READ_DTC_INFORMATION,
            READ_DATA_BY_IDENTIFIER,
            READ_MEMORY_BY_ADDRESS,
            READ_SCALING_DATA_BY_IDENTIFIER,
            SECURITY_ACCESS,
            COMMUNICATION_CONTROL,
            READ_DATA_BY_PERIODIC_IDENTIFIER,
            DYNAMICALLY_DEFINE_DATA_IDENTIFIER,
            WRITE_DATA_BY_IDENTIFIER,
            INPUT_OUTPUT_CONTROL_BY_IDENTIFIER,
            ROUTINE_CONTROL,
            REQUEST_DOWNLOAD,
            REQUEST_UPLOAD,
            TRANSFER_DATA,
            REQUEST_TRANSFER_EXIT,
            WRITE_MEMORY_BY_ADDRESS,
            TESTER_PRESENT,
            ACCESS_TIMING_PARAMETER,
            SECURED_DATA_TRANSMISSION,
            CONTROL_DTC_SETTING,
            RESPONSE_ON_EVENT,
            LINK_CONTROL
    );

    private StandardServices() {}

    public static List<ServiceDescriptor> all() {
        return ALL;
    }

    /**
     * Returns a fresh registry holding every standard service.
     */
    public static ServiceRegistry registry() {
        return ServiceRegistry.builder().registerAll(ALL).build();
    }
}
