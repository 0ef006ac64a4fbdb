package com.questrail.diagnostics.protocol.uds.codec.impl;

import com.questrail.diagnostics.protocol.uds.UdsConfigurationException;
import com.questrail.diagnostics.protocol.uds.model.Response;
import com.questrail.diagnostics.protocol.uds.model.ResponseCode;
import com.questrail.diagnostics.protocol.uds.service.StandardServices;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultResponseFramerTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link DefaultResponseFramer}.
 *
 * <p>Malformed payloads never throw; they decode to invalid responses with a
 * reason.</p>
 */
final class DefaultResponseFramerTest
{
    private final DefaultResponseFramer framer = new DefaultResponseFramer(StandardServices.registry());

    @Test
    void positiveResponseWithData()
    {
        Response response = framer.decode(new byte[] { 0x62, 0x01, 0x02, 0x03 });

        assertTrue(response.valid());
        assertTrue(response.positive());
        assertEquals(StandardServices.READ_DATA_BY_IDENTIFIER, response.service().orElseThrow());
        assertEquals(0, response.code().orElseThrow());
        assertArrayEquals(new byte[] { 0x01, 0x02, 0x03 }, response.data().orElseThrow());
    }

    @Test
    void standardNegativeResponse()
    {
        Response response = framer.decode(new byte[] { 0x7F, 0x22, 0x31 });

        assertTrue(response.valid());
        assertFalse(response.positive());
        assertEquals(StandardServices.READ_DATA_BY_IDENTIFIER, response.service().orElseThrow());
        assertEquals(0x31, response.code().orElseThrow());
        assertEquals("RequestOutOfRange", response.codeName());
    }

    @Test
    void standardNegativeResponseMissingCode()
    {
        Response response = framer.decode(new byte[] { 0x7F, 0x22 });

        assertFalse(response.valid());
        assertTrue(response.invalidReason().contains("Incomplete negative response"));
    }

    @Test
    void standardNegativeResponseForUnknownService()
    {
        Response response = framer.decode(new byte[] { 0x7F, (byte) 0xBA, 0x11 });

        assertFalse(response.valid());
        assertEquals(DefaultResponseFramer.UNKNOWN_SERVICE, response.invalidReason());
    }

    @Test
    void negativeResponseAfterResponseId()
    {
        Response response = framer.decode(new byte[] { 0x67, 0x7F, 0x35 });

        assertTrue(response.valid());
        assertFalse(response.positive());
        assertEquals(StandardServices.SECURITY_ACCESS, response.service().orElseThrow());
        assertEquals(ResponseCode.INVALID_KEY, response.responseCode().orElseThrow());
        assertTrue(response.data().isEmpty());
    }

    @Test
    void negativeResponseAfterResponseIdMissingCode()
    {
        Response response = framer.decode(new byte[] { 0x67, 0x7F });

        assertFalse(response.valid());
        assertEquals(DefaultResponseFramer.INCOMPLETE_NEGATIVE_RESPONSE, response.invalidReason());
    }

    @Test
    void negativeResponseTrailingBytesAreKept()
    {
        Response response = framer.decode(new byte[] { 0x67, 0x7F, 0x35, 0x01, 0x02 });

        assertTrue(response.valid());
        assertFalse(response.positive());
        assertArrayEquals(new byte[] { 0x01, 0x02 }, response.data().orElseThrow());
    }

    @Test
    void unknownResponseIdIsInvalid()
    {
        Response response = framer.decode(new byte[] { (byte) 0xFA, 0x00 });

        assertFalse(response.valid());
        assertTrue(response.service().isEmpty());
        assertTrue(response.invalidReason().contains("unknown service"));
    }

    @Test
    void emptyPayloadIsInvalid()
    {
        assertFalse(framer.decode(new byte[0]).valid());
        assertFalse(framer.decode(null).valid());
    }

    @Test
    void singleByteForServiceWithoutResponseData()
    {
        Response response = framer.decode(new byte[] { 0x54 });

        assertTrue(response.valid());
        assertTrue(response.positive());
        assertEquals(StandardServices.CLEAR_DIAGNOSTIC_INFORMATION, response.service().orElseThrow());
    }

    @Test
    void singleByteForServiceWithResponseDataIsTooShort()
    {
        Response response = framer.decode(new byte[] { 0x62 });

        assertFalse(response.valid());
        assertEquals(StandardServices.READ_DATA_BY_IDENTIFIER, response.service().orElseThrow());
        assertEquals(DefaultResponseFramer.PAYLOAD_TOO_SHORT, response.invalidReason());
    }

    @Test
    void encodePositiveAndNegative()
    {
        Response positive = Response.positive(StandardServices.TESTER_PRESENT, new byte[] { 0x00 });
        Response negative = Response.negative(StandardServices.ECU_RESET, ResponseCode.CONDITIONS_NOT_CORRECT);

        assertArrayEquals(new byte[] { 0x7E, 0x00 }, framer.encode(positive));
        assertArrayEquals(new byte[] { 0x51, 0x7F, 0x22 }, framer.encode(negative));
        assertEquals(3, framer.encodedLength(negative));
    }

    @Test
    void encodeServiceWithoutResponseDataEmitsIdOnly()
    {
        assertArrayEquals(new byte[] { 0x54 },
                framer.encode(Response.positive(StandardServices.CLEAR_DIAGNOSTIC_INFORMATION)));
    }

    @Test
    void encodeWithoutServiceOrCodeFails()
    {
        assertThrows(UdsConfigurationException.class, () -> framer.encode(Response.of(null, 0, null)));
        assertThrows(UdsConfigurationException.class,
                () -> framer.encode(Response.of(StandardServices.ECU_RESET, null, null)));
        assertEquals(0, framer.encodedLength(Response.of(null, 0, null)));
    }

    @Test
    void encodeThenDecodePreservesFields()
    {
        Response positive = Response.positive(StandardServices.ROUTINE_CONTROL, new byte[] { 0x01, 0x02, 0x00 });
        Response decodedPositive = framer.decode(framer.encode(positive));
        assertEquals(positive.service(), decodedPositive.service());
        assertTrue(decodedPositive.positive());
        assertEquals(positive.code(), decodedPositive.code());
        assertArrayEquals(positive.data().orElseThrow(), decodedPositive.data().orElseThrow());

        Response negative = Response.negative(StandardServices.REQUEST_DOWNLOAD, ResponseCode.UPLOAD_DOWNLOAD_NOT_ACCEPTED);
        Response decodedNegative = framer.decode(framer.encode(negative));
        assertEquals(negative.service(), decodedNegative.service());
        assertFalse(decodedNegative.positive());
        assertEquals(negative.code(), decodedNegative.code());
        assertTrue(decodedNegative.data().isEmpty());
    }
}
