package com.questrail.diagnostics.protocol.uds;

/**
 * Indicates that a caller supplied an invalid or incomplete protocol
 * configuration: an unregistered service, a malformed subfunction, a bad DID
 * codec specification, or a value outside its wire range.
 *
 * <p>Always raised synchronously at the call that supplied the bad input.
 * Malformed <em>received</em> payloads never raise this exception; they are
 * reported through invalid result objects instead.</p>
 */
public class UdsConfigurationException extends IllegalArgumentException
{
    public UdsConfigurationException(String message) {
        super(message);
    }

    public UdsConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
