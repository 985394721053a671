/**
 * Concrete line-oriented LSNP codec.
 *
 * <pre>
 *   byte[] datagram
 *        → strict UTF-8 decode
 *        → LsnpFraming.body        (terminator check)
 *        → split lines, first colon splits key/value
 *        → LineEscaping.unescape   (per value)
 *        → LsnpMessage
 * </pre>
 *
 * <p>Any failure at this layer results in the datagram being dropped by the
 * runtime.</p>
 */
package com.questrail.lsnp.codec.impl;
