package com.questrail.lsnp.codec.impl;

import com.questrail.lsnp.api.PayloadTooLargeException;
import com.questrail.lsnp.codec.LsnpMessageEncoder;
import com.questrail.lsnp.codec.PayloadLimits;
import com.questrail.lsnp.model.LsnpMessage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;

/**
 * DefaultLsnpMessageEncoder
 * -----------------------------------------------------------------------------
 * Writes fields in insertion order as {@code KEY:VALUE} lines followed by an
 * empty line, then applies {@link PayloadLimits}.
 */
public final class DefaultLsnpMessageEncoder implements LsnpMessageEncoder
{
    private static final Logger log = LoggerFactory.getLogger(DefaultLsnpMessageEncoder.class);

    private final PayloadLimits limits;

    public DefaultLsnpMessageEncoder() {
        this(PayloadLimits.defaults());
    }

    public DefaultLsnpMessageEncoder(PayloadLimits limits) {
        this.limits = Objects.requireNonNull(limits, "limits");
    }

    @Override
    public byte[] encode(LsnpMessage message)
    {
        Objects.requireNonNull(message, "message");

        StringBuilder sb = new StringBuilder(128);
        for (Map.Entry<String, String> e : message.fields().entrySet()) {
            sb.append(e.getKey()).append(':').append(LineEscaping.escape(e.getValue())).append('\n');
        }
        sb.append('\n');

        byte[] bytes = sb.toString().getBytes(StandardCharsets.UTF_8);

        if (bytes.length > limits.hardLimitBytes()) {
            throw new PayloadTooLargeException(message.typeName() + " message", bytes.length, limits.hardLimitBytes());
        }
        if (bytes.length > limits.softLimitBytes()) {
            log.warn("{} message is {} bytes, above the recommended {} bytes",
                    message.typeName(), bytes.length, limits.softLimitBytes());
        }
        return bytes;
    }
}
