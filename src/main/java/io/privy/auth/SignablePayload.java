package io.privy.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The subset of a request that authorization signatures cover: method, URL, body and the Privy headers.
 * <p>
 * Instances are immutable and a pure function of their inputs, so the same request always canonicalizes to the same
 * bytes.
 *
 * @author Privy Engineering
 */
public final class SignablePayload {
   public static final int VERSION = 1;
   public static final String HEADER_PREFIX = "privy-";
   public static final String APP_ID_HEADER = "privy-app-id";
   public static final String SIGNATURE_HEADER = "privy-authorization-signature";

   private final String method;
   private final String url;
   private final JsonNode body;
   private final SortedMap<String, String> headers;

   private SignablePayload(String method, String url, JsonNode body, SortedMap<String, String> headers) {
      this.method = method;
      this.url = url;
      this.body = body;
      this.headers = Collections.unmodifiableSortedMap(headers);
   }

   /**
    * Creates a payload whose only header is the app id.
    */
   public static SignablePayload of(String method, String url, JsonNode body, String appId) {
      return of(method, url, body, appId, Collections.<String, String>emptyMap());
   }

   /**
    * Creates a payload from the live headers of a request. Only headers named with the {@value #HEADER_PREFIX} prefix
    * are kept, the signature header itself is dropped, and {@value #APP_ID_HEADER} is always set to {@code appId}.
    */
   public static SignablePayload of(String method, String url, JsonNode body, String appId,
                                    Map<String, String> requestHeaders) {
      requireText(method, "method");
      requireText(url, "url");
      requireText(appId, "appId");

      // a JSON null body is signed as null; only an absent body becomes {}
      JsonNode payloadBody = body == null || body.isMissingNode()
            ? JsonNodeFactory.instance.objectNode()
            : body.deepCopy();
      return new SignablePayload(method.trim().toUpperCase(Locale.ROOT), url, payloadBody,
            selectHeaders(requestHeaders, appId));
   }

   static SortedMap<String, String> selectHeaders(Map<String, String> requestHeaders, String appId) {
      SortedMap<String, String> selected = new TreeMap<>();
      for (Map.Entry<String, String> header : requestHeaders.entrySet()) {
         String name = header.getKey().toLowerCase(Locale.ROOT);
         if (name.startsWith(HEADER_PREFIX) && !name.equals(SIGNATURE_HEADER) && header.getValue() != null) {
            selected.put(name, header.getValue());
         }
      }
      selected.put(APP_ID_HEADER, appId);
      return selected;
   }

   public String getMethod() {
      return method;
   }

   public String getUrl() {
      return url;
   }

   /**
    * @return a copy of the body, so callers cannot change what gets signed
    */
   public JsonNode getBody() {
      return body.deepCopy();
   }

   public SortedMap<String, String> getHeaders() {
      return headers;
   }

   public String getAppId() {
      return headers.get(APP_ID_HEADER);
   }

   public ObjectNode toJson() {
      ObjectNode json = JsonNodeFactory.instance.objectNode();
      json.put("version", VERSION);
      json.put("method", method);
      json.put("url", url);
      json.set("body", body.deepCopy());
      ObjectNode headerNode = json.putObject("headers");
      for (Map.Entry<String, String> header : headers.entrySet()) {
         headerNode.put(header.getKey(), header.getValue());
      }
      return json;
   }

   public byte[] canonicalBytes() {
      return JsonCanonicalizer.canonicalBytes(toJson());
   }

   public String canonicalString() {
      return JsonCanonicalizer.canonicalize(toJson());
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) {
         return true;
      }
      if (!(o instanceof SignablePayload)) {
         return false;
      }
      SignablePayload that = (SignablePayload) o;
      return method.equals(that.method) && url.equals(that.url) && body.equals(that.body)
            && headers.equals(that.headers);
   }

   @Override
   public int hashCode() {
      return Objects.hash(method, url, body, headers);
   }

   @Override
   public String toString() {
      return "SignablePayload{method=" + method + ", url=" + url + ", headers=" + headers.keySet() + "}";
   }

   private static void requireText(String value, String name) {
      if (value == null || value.trim().isEmpty()) {
         throw new IllegalArgumentException(name + " must not be empty");
      }
   }
}
