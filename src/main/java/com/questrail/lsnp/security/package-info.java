/**
 * Optional message tokens.
 *
 * <p>A token has the form {@code user_id|expiry_epoch_seconds|scope} and is
 * carried in the {@code TOKEN} field. Issuing and checking are both off by
 * default: {@link com.questrail.lsnp.security.TokenIssuer#NONE} stamps nothing and
 * {@link com.questrail.lsnp.security.TokenVerifier#ACCEPT_ALL} lets everything
 * through.</p>
 */
package com.questrail.lsnp.security;
