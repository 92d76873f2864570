package io.privy.auth;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Signing logic supplied by the caller, for example a call to a KMS or HSM. It may block; no timeout is applied
 * around it.
 *
 * @author Privy Engineering
 */
@FunctionalInterface
public interface CustomSignFunction {

   /**
    * @param method  the uppercase HTTP method
    * @param url     the full request URL
    * @param body    the parsed request body, an empty object if the request has none
    * @param appId   the Privy app id
    * @return the signature, never null
    * @throws Exception if signing fails; it is reported as a {@link SigningFailedException}
    */
   SignatureResult sign(String method, String url, JsonNode body, String appId) throws Exception;
}
