package com.questrail.diagnostics.protocol.uds.observability;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

final class Slf4jUdsObservabilitySinkTest
{
    @Test
    void frameEventRendersPayloadAsHex()
    {
        byte[] payload = { 0x62, (byte) 0xF1, (byte) 0x90 };
        UdsFrameEvent event = new UdsFrameEvent(Instant.now(), 0x7E8, payload);
        payload[0] = 0;

        assertEquals("62f190", event.payloadHex());
        assertEquals(0x62, event.payload()[0]);
    }

    @Test
    void everyEventKindIsAccepted()
    {
        UdsObservabilitySink sink = new Slf4jUdsObservabilitySink();
        Instant now = Instant.now();

        assertDoesNotThrow(() -> {
            sink.onFrameSent(new UdsFrameEvent(now, 0x7E0, new byte[] { 0x3E, 0x00 }));
            sink.onFrameReceived(new UdsFrameEvent(now, 0x7E8, new byte[] { 0x7E, 0x00 }));
            sink.onTransportEvent(new UdsTransportEvent(now, UdsTransportEvent.Kind.OPENED, "vcan0"));
            sink.onError(new UdsErrorEvent(now, "receiver stopped", new IOException("down")));
        });
    }
}
