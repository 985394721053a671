/**
 * LSNP Codec
 * =============================================================================
 *
 * <p>Boundary between raw datagram payloads and {@link com.questrail.lsnp.model.LsnpMessage}.</p>
 *
 * <h2>Wire format</h2>
 * <pre>
 *   TYPE:DM\n
 *   FROM:alice@10.0.0.1\n
 *   TO:bob@10.0.0.2\n
 *   CONTENT:hi\n
 *   \n
 * </pre>
 *
 * <p>One message per datagram, UTF-8, one {@code KEY:VALUE} line per field,
 * terminated by an empty line. Only the first colon of a line separates key
 * from value. Line breaks and backslashes inside values are escaped so that
 * multi-line text survives the line-oriented framing.</p>
 *
 * <h2>Placement</h2>
 * <pre>
 *   byte[] datagram
 *        → LsnpMessageDecoder
 *            → LsnpMessage
 *                → MessageRouter
 * </pre>
 *
 * <p>Codecs hold no protocol state and interpret no field beyond {@code TYPE}.
 * Decode failures are reported as
 * {@link com.questrail.lsnp.api.InvalidMessageFormatException}.</p>
 */
package com.questrail.lsnp.codec;
