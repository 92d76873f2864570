package io.privy.auth;

import org.apache.http.client.methods.HttpUriRequest;

/**
 * Utility for signing HTTP requests made to the Privy API.
 *
 * @author Privy Engineering
 */
public interface RequestSigner {

   /**
    * Adds the following headers:
    * <ul>
    *    <li>privy-app-id: the configured app id, replacing any value already present</li>
    *    <li>privy-authorization-signature: the comma separated authorization signatures of the request</li>
    * </ul>
    *
    * The body of the request is read to compute the signatures and is reinstated unchanged afterwards, whether or
    * not signing succeeds.
    */
   void signRequest(HttpUriRequest request);

   /**
    * Same as {@link #signRequest(HttpUriRequest)}, for any transport.
    */
   void signRequest(SignableRequest request);
}
