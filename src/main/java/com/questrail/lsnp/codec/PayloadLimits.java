package com.questrail.lsnp.codec;

/**
 * Size limits applied to outbound payloads.
 *
 * @param softLimitBytes   encoded size above which a warning is logged
 * @param hardLimitBytes   encoded size above which encoding is refused
 * @param avatarLimitBytes raw avatar image size above which a profile is refused
 */
public record PayloadLimits(int softLimitBytes, int hardLimitBytes, int avatarLimitBytes)
{
    /** Largest UDP payload over IPv4 (65535 - 8 byte UDP header - 20 byte IP header). */
    public static final int MAX_UDP_PAYLOAD = 65_507;

    public PayloadLimits {
        if (softLimitBytes <= 0 || hardLimitBytes <= 0 || avatarLimitBytes <= 0) {
            throw new IllegalArgumentException("Limits must be positive");
        }
        if (softLimitBytes > hardLimitBytes) {
            throw new IllegalArgumentException("softLimitBytes must be <= hardLimitBytes");
        }
        if (hardLimitBytes > MAX_UDP_PAYLOAD) {
            throw new IllegalArgumentException("hardLimitBytes must be <= " + MAX_UDP_PAYLOAD);
        }
    }

    public static PayloadLimits defaults() {
        return new PayloadLimits(20 * 1024, MAX_UDP_PAYLOAD, 20 * 1024);
    }
}
