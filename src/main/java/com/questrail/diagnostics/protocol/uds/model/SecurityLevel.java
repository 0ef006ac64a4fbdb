package com.questrail.diagnostics.protocol.uds.model;

import com.questrail.diagnostics.protocol.uds.UdsConfigurationException;

/**
 * A SecurityAccess level.
 *
 * <p>A level is built from its odd "request seed" subfunction (0x01, 0x03,
 * ...) and stored as the even base obtained by clearing bit 0. The request
 * seed and send key subfunctions are derived from that base.</p>
 *
 * @param levelId normalized (even) level identifier
 */
public record SecurityLevel(int levelId)
{
    public SecurityLevel {
        if (levelId < 0 || levelId > 0x7F) {
            throw new UdsConfigurationException("Security level must be in range 0x00–0x7F (was " + levelId + ")");
        }
        levelId = levelId & 0xFE;
    }

    public static SecurityLevel of(int levelId) {
        return new SecurityLevel(levelId);
    }

    /**
     * Subfunction requesting the seed for this level.
     */
    public int requestSeedSubfunction() {
        return levelId + 1;
    }

    /**
     * Subfunction sending the computed key for this level.
     */
    public int sendKeySubfunction() {
        return levelId + 2;
    }
}
