package io.privy.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.apache.http.client.methods.HttpUriRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Signs requests to the Privy API with the signatures of an {@link AuthorizationContext}.
 * <p>
 * The signature covers the method, the absolute URL, the JSON body and the {@value SignablePayload#HEADER_PREFIX}
 * headers of the request. Only mutating methods are signed by default.
 *
 * @author Privy Engineering
 */
public class AuthorizationRequestSigner implements RequestSigner {
   private static final Logger LOG = LoggerFactory.getLogger(AuthorizationRequestSigner.class);

   public static final Set<String> DEFAULT_SIGNED_METHODS =
         Collections.unmodifiableSet(new TreeSet<>(Arrays.asList("POST", "PUT", "PATCH", "DELETE")));

   private static final ObjectMapper MAPPER = new ObjectMapper()
         .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

   private final String appId;
   private final AuthorizationContext context;
   private final Set<String> signedMethods;

   public AuthorizationRequestSigner(String appId, AuthorizationContext context) {
      this(appId, context, DEFAULT_SIGNED_METHODS);
   }

   public AuthorizationRequestSigner(String appId, AuthorizationContext context, Set<String> signedMethods) {
      if (appId == null || appId.trim().isEmpty()) {
         throw new IllegalArgumentException("appId must not be empty");
      }
      if (context == null) {
         throw new IllegalArgumentException("context must not be null");
      }
      this.appId = appId;
      this.context = context;
      this.signedMethods = upperCase(signedMethods);
   }

   /**
    * Creates a signer for the app id and authorization key found in system properties or environment variables.
    */
   public static AuthorizationRequestSigner fromSettings(SignerSettings settings) {
      return new AuthorizationRequestSigner(settings.getAppId(), settings.toAuthorizationContext());
   }

   public String getAppId() {
      return appId;
   }

   public AuthorizationContext getContext() {
      return context;
   }

   @Override
   public void signRequest(HttpUriRequest request) {
      signRequest(new HttpClientSignableRequest(request));
   }

   @Override
   public void signRequest(SignableRequest request) {
      // the signed app id and the one sent on the wire must agree
      request.setHeader(SignablePayload.APP_ID_HEADER, appId);
      // only signatures computed here may be sent
      request.removeHeader(SignablePayload.SIGNATURE_HEADER);

      String method = request.getMethod().toUpperCase(Locale.ROOT);
      if (!context.hasSigningMethods()) {
         LOG.debug("Skipping authorization signature for {} {}: no signing methods configured", method,
               request.getUrl());
         return;
      }
      if (!signedMethods.contains(method)) {
         return;
      }

      String url = request.getUrl();
      byte[] body = null;
      try {
         try {
            body = request.readBody();
         } catch (IOException e) {
            // nothing complete was captured, so there is nothing to reinstate
            throw new AuthorizationException("Could not read body of " + method + " " + url, e);
         }

         SignablePayload payload = SignablePayload.of(method, url, parseBody(body), appId, privyHeaders(request));
         LOG.debug("Generating authorization signature for {} {} with headers {}", method, url,
               payload.getHeaders().keySet());

         List<String> signatures = context.generateSignatures(payload);
         request.setHeader(SignablePayload.SIGNATURE_HEADER, AuthorizationContext.authorizationHeaderValue(signatures));
         LOG.debug("Added {} authorization signature(s) to {} {}", signatures.size(), method, url);
      } finally {
         if (body != null) {
            request.replaceBody(body);
         }
      }
   }

   JsonNode parseBody(byte[] body) {
      if (new String(body, StandardCharsets.UTF_8).trim().isEmpty()) {
         return JsonNodeFactory.instance.objectNode();
      }
      try {
         return MAPPER.readTree(body);
      } catch (JsonProcessingException e) {
         throw new CanonicalizationException("Request body is not valid JSON", e);
      } catch (IOException e) {
         throw new CanonicalizationException("Could not parse request body", e);
      }
   }

   Map<String, String> privyHeaders(SignableRequest request) {
      Map<String, String> headers = new LinkedHashMap<>();
      for (String name : request.getHeaderNames()) {
         if (name.toLowerCase(Locale.ROOT).startsWith(SignablePayload.HEADER_PREFIX)) {
            headers.put(name, request.getHeader(name));
         }
      }
      return headers;
   }

   private static Set<String> upperCase(Set<String> methods) {
      Set<String> result = new TreeSet<>();
      for (String method : methods) {
         result.add(method.toUpperCase(Locale.ROOT));
      }
      return Collections.unmodifiableSet(result);
   }
}
