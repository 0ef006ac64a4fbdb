package com.questrail.diagnostics.protocol.uds.model;

import com.questrail.diagnostics.protocol.uds.UdsConfigurationException;

/**
 * Builds the addressAndLengthFormatIdentifier byte used by the memory access
 * services (ReadMemoryByAddress, RequestDownload, ...).
 *
 * <p>High nibble: number of bytes of the memory size field. Low nibble:
 * number of bytes of the memory address field. Both selectors are 1-based.</p>
 */
public final class AddressAndLengthIdentifier
{
    public static final int ADDR_256B = 1;
    public static final int ADDR_64KB = 2;
    public static final int ADDR_16MB = 3;
    public static final int ADDR_4GB = 4;
    public static final int ADDR_1024GB = 5;

    public static final int MSIZE_256B = 1;
    public static final int MSIZE_64KB = 2;
    public static final int MSIZE_16MB = 3;
    public static final int MSIZE_4GB = 4;

    private AddressAndLengthIdentifier() {}

    /**
     * @param size memory size selector, {@link #MSIZE_256B}–{@link #MSIZE_4GB}
     * @param addr address selector, {@link #ADDR_256B}–{@link #ADDR_1024GB}
     * @return {@code (size << 4) | addr}
     * @throws UdsConfigurationException if either selector is out of range
     */
    public static int make(int size, int addr) {
        if (size < MSIZE_256B || size > MSIZE_4GB) {
            throw new UdsConfigurationException("Size must be an integer between 1 and 4 (was " + size + ")");
        }
        if (addr < ADDR_256B || addr > ADDR_1024GB) {
            throw new UdsConfigurationException("Addr must be an integer between 1 and 5 (was " + addr + ")");
        }
        return (size << 4) | addr;
    }
}
