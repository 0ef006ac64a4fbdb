package com.questrail.diagnostics.protocol.uds.service;

import com.questrail.diagnostics.protocol.uds.UdsConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class ServiceRegistryTest
{
    @Test
    void standardRegistryResolvesBothDirections()
    {
        ServiceRegistry registry = StandardServices.registry();

        assertEquals(StandardServices.READ_DATA_BY_IDENTIFIER, registry.byRequestId(0x22).orElseThrow());
        assertEquals(StandardServices.READ_DATA_BY_IDENTIFIER, registry.byResponseId(0x62).orElseThrow());
        assertTrue(registry.byRequestId(0x62).isEmpty());
        assertTrue(registry.byResponseId(0x22).isEmpty());
    }

    @Test
    void responseIdIsRequestIdPlusOffset()
    {
        for (ServiceDescriptor s : StandardServices.all()) {
            assertEquals(s.requestId() + ServiceDescriptor.RESPONSE_ID_OFFSET, s.responseId(), s.name());
        }
    }

    @Test
    void standardIdsAreUnique()
    {
        Set<Integer> requestIds = new HashSet<>();
        for (ServiceDescriptor s : StandardServices.all()) {
            assertTrue(requestIds.add(s.requestId()), "duplicate request id for " + s.name());
        }
        assertEquals(StandardServices.all().size(), StandardServices.registry().services().size());
    }

    @Test
    void duplicateRequestIdIsRejected()
    {
        ServiceRegistry.Builder builder = ServiceRegistry.builder()
                .register(ServiceDescriptor.of("Alpha", 0x31, true, true));

        assertThrows(UdsConfigurationException.class,
                () -> builder.register(ServiceDescriptor.of("Beta", 0x31, false, true)));
    }

    @Test
    void duplicateResponseIdIsRejected()
    {
        ServiceRegistry.Builder builder = ServiceRegistry.builder()
                .register(new ServiceDescriptor("Alpha", 0x31, 0x71, true, true));

        assertThrows(UdsConfigurationException.class,
                () -> builder.register(new ServiceDescriptor("Beta", 0x32, 0x71, true, true)));
    }

    @Test
    void customRegistryIsIndependentOfStandardOne()
    {
        ServiceDescriptor vendor = ServiceDescriptor.of("VendorSpecific", 0xBA, false, true);
        ServiceRegistry registry = ServiceRegistry.builder().register(vendor).build();

        assertTrue(registry.contains(vendor));
        assertFalse(registry.contains(StandardServices.TESTER_PRESENT));
        assertFalse(StandardServices.registry().contains(vendor));
    }

    @Test
    void descriptorRejectsIdsOutsideByteRange()
    {
        assertThrows(UdsConfigurationException.class, () -> ServiceDescriptor.of("Bad", 0x100, false, false));
        assertThrows(UdsConfigurationException.class, () -> ServiceDescriptor.of("Bad", -1, false, false));
    }

    @Test
    void negativeResponseMarkerCannotBeAResponseId()
    {
        ServiceDescriptor clash = ServiceDescriptor.of("VendorSpecific", 0x3F, false, true);

        assertEquals(0x7F, clash.responseId());
        assertThrows(UdsConfigurationException.class, () -> ServiceRegistry.builder().register(clash));
    }
}
