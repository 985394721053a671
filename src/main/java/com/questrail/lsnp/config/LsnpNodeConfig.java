package com.questrail.lsnp.config;

import com.questrail.lsnp.codec.PayloadLimits;
import com.questrail.lsnp.model.UserId;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.UnknownHostException;
import java.util.Objects;

/**
 * Aggregated configuration for one LSNP node.
 *
 * @param username             local part of this node's user id
 * @param localAddress         address peers reach us on; its text form is the
 *                             host part of the user id
 * @param discoveryPort        well-known port for announcements
 * @param broadcastAddress     destination of broadcasts
 * @param unicastPort          bind port for the unicast endpoint; 0 for ephemeral
 * @param inboxCapacity        datagrams buffered between the socket and the receive loop
 * @param tokensEnabled        stamp outbound messages with a {@code TOKEN} and verify inbound ones
 * @param duplicateFilterEnabled drop inbound messages whose {@code MESSAGE_ID} was seen recently
 * @param duplicateFilterCapacity how many recent ids to remember
 */
public record LsnpNodeConfig(
    String username,
    InetAddress localAddress,
    int discoveryPort,
    InetAddress broadcastAddress,
    int unicastPort,
    LsnpTimingPolicy timingPolicy,
    PayloadLimits payloadLimits,
    int inboxCapacity,
    boolean tokensEnabled,
    boolean duplicateFilterEnabled,
    int duplicateFilterCapacity
) {
    public static final int DEFAULT_DISCOVERY_PORT = 50999;

    public LsnpNodeConfig {
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(localAddress, "localAddress");
        Objects.requireNonNull(broadcastAddress, "broadcastAddress");
        Objects.requireNonNull(timingPolicy, "timingPolicy");
        Objects.requireNonNull(payloadLimits, "payloadLimits");

        if (username.isBlank() || username.contains("@")) {
            throw new IllegalArgumentException("username must be non-blank and must not contain '@'");
        }
        if (discoveryPort <= 0 || discoveryPort > 65535) {
            throw new IllegalArgumentException("discoveryPort out of range: " + discoveryPort);
        }
        if (unicastPort < 0 || unicastPort > 65535) {
            throw new IllegalArgumentException("unicastPort out of range: " + unicastPort);
        }
        if (inboxCapacity <= 0) {
            throw new IllegalArgumentException("inboxCapacity must be > 0");
        }
        if (duplicateFilterCapacity <= 0) {
            throw new IllegalArgumentException("duplicateFilterCapacity must be > 0");
        }
    }

    public UserId userId() {
        return UserId.of(username, localAddress.getHostAddress());
    }

    public InetSocketAddress broadcastTarget() {
        return new InetSocketAddress(broadcastAddress, discoveryPort);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String username;
        private InetAddress localAddress;
        private int discoveryPort = DEFAULT_DISCOVERY_PORT;
        private InetAddress broadcastAddress = limitedBroadcast();
        private int unicastPort = 0;
        private LsnpTimingPolicy timingPolicy = LsnpTimingPolicy.defaults();
        private PayloadLimits payloadLimits = PayloadLimits.defaults();
        private int inboxCapacity = 1024;
        private boolean tokensEnabled = false;
        private boolean duplicateFilterEnabled = false;
        private int duplicateFilterCapacity = 1000;

        public Builder withUsername(String username) {
            this.username = username;
            return this;
        }

        public Builder withLocalAddress(InetAddress address) {
            this.localAddress = address;
            return this;
        }

        public Builder withDiscoveryPort(int port) {
            this.discoveryPort = port;
            return this;
        }

        public Builder withBroadcastAddress(InetAddress address) {
            this.broadcastAddress = address;
            return this;
        }

        public Builder withUnicastPort(int port) {
            this.unicastPort = port;
            return this;
        }

        public Builder withTimingPolicy(LsnpTimingPolicy policy) {
            this.timingPolicy = policy;
            return this;
        }

        public Builder withPayloadLimits(PayloadLimits limits) {
            this.payloadLimits = limits;
            return this;
        }

        public Builder withInboxCapacity(int capacity) {
            this.inboxCapacity = capacity;
            return this;
        }

        public Builder withTokensEnabled(boolean enabled) {
            this.tokensEnabled = enabled;
            return this;
        }

        public Builder withDuplicateFilter(boolean enabled, int capacity) {
            this.duplicateFilterEnabled = enabled;
            this.duplicateFilterCapacity = capacity;
            return this;
        }

        public LsnpNodeConfig build() {
            return new LsnpNodeConfig(username, localAddress, discoveryPort, broadcastAddress, unicastPort,
                    timingPolicy, payloadLimits, inboxCapacity, tokensEnabled,
                    duplicateFilterEnabled, duplicateFilterCapacity);
        }

        private static InetAddress limitedBroadcast() {
            try {
                return InetAddress.getByAddress(new byte[] {(byte) 255, (byte) 255, (byte) 255, (byte) 255});
            } catch (UnknownHostException e) {
                throw new IllegalStateException("Cannot represent 255.255.255.255", e);
            }
        }
    }
}
