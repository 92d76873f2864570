package io.privy.auth;

import java.io.IOException;
import java.util.List;

/**
 * The capabilities of an outbound HTTP request that request signing depends on.
 *
 * @author Privy Engineering
 */
public interface SignableRequest {

   String getMethod();

   /**
    * @return the absolute URL the request is sent to
    */
   String getUrl();

   /**
    * Reads the complete body. Reading may consume the body; callers must reinstate it with
    * {@link #replaceBody(byte[])}. If the read fails partway there are no complete bytes to reinstate, and the body is
    * left as the failed read left it.
    *
    * @return the body bytes, empty if the request has no body
    */
   byte[] readBody() throws IOException;

   /**
    * Replaces the transmittable body with exactly the given bytes.
    */
   void replaceBody(byte[] body);

   /**
    * @return the value of the first header with the given name (case insensitive), or null
    */
   String getHeader(String name);

   /**
    * Sets a header, replacing any header with the same name.
    */
   void setHeader(String name, String value);

   /**
    * Removes every header with the given name (case insensitive).
    */
   void removeHeader(String name);

   List<String> getHeaderNames();
}
