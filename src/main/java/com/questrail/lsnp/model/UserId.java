package com.questrail.lsnp.model;

import java.util.Objects;

/**
 * Strongly typed LSNP user identifier of the form {@code username@host}.
 *
 * <p>The host part is normally the IPv4 address the peer announces from. The
 * identifier is unique per running node; two processes on the same host must
 * use different usernames.</p>
 */
public final class UserId implements Comparable<UserId>
{
    private final String username;
    private final String host;

    private UserId(String username, String host) {
        this.username = username;
        this.host = host;
    }

    public static UserId of(String username, String host) {
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(host, "host");
        if (username.isEmpty() || username.indexOf('@') >= 0) {
            throw new IllegalArgumentException("Invalid username: '" + username + "'");
        }
        if (host.isEmpty() || host.indexOf('@') >= 0) {
            throw new IllegalArgumentException("Invalid host: '" + host + "'");
        }
        return new UserId(username, host);
    }

    /**
     * Parses a wire value such as {@code alice@10.0.0.1}.
     *
     * @throws IllegalArgumentException if the value is not {@code user@host}
     */
    public static UserId parse(String value) {
        Objects.requireNonNull(value, "value");
        int at = value.indexOf('@');
        if (at <= 0 || at != value.lastIndexOf('@') || at == value.length() - 1) {
            throw new IllegalArgumentException("User id must be username@host (was '" + value + "')");
        }
        return new UserId(value.substring(0, at), value.substring(at + 1));
    }

    public String username() {
        return username;
    }

    public String host() {
        return host;
    }

    /**
     * Wire representation.
     */
    public String value() {
        return username + "@" + host;
    }

    @Override
    public int compareTo(UserId o) {
        return value().compareTo(o.value());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UserId that)) return false;
        return username.equals(that.username) && host.equals(that.host);
    }

    @Override
    public int hashCode() {
        return Objects.hash(username, host);
    }

    @Override
    public String toString() {
        return value();
    }
}
