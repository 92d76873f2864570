package io.privy.auth;

import org.apache.http.Header;
import org.apache.http.HttpEntity;
import org.apache.http.HttpEntityEnclosingRequest;
import org.apache.http.HttpHost;
import org.apache.http.HttpRequest;
import org.apache.http.client.methods.HttpRequestWrapper;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.entity.ByteArrayEntity;
import org.apache.http.util.EntityUtils;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link SignableRequest} backed by an Apache HttpClient request.
 * <p>
 * Relative request URIs, as seen by interceptors once HttpClient has rewritten the request, are resolved against the
 * target host.
 *
 * @author Privy Engineering
 */
public class HttpClientSignableRequest implements SignableRequest {
   private final HttpRequest request;
   private final HttpHost target;

   public HttpClientSignableRequest(HttpUriRequest request) {
      this(request, null);
   }

   public HttpClientSignableRequest(HttpRequest request, HttpHost target) {
      this.request = request;
      this.target = target;
   }

   @Override
   public String getMethod() {
      return request.getRequestLine().getMethod();
   }

   @Override
   public String getUrl() {
      URI uri = request instanceof HttpUriRequest
            ? ((HttpUriRequest) request).getURI()
            : URI.create(request.getRequestLine().getUri());
      if (uri.isAbsolute()) {
         return uri.toString();
      }

      if (request instanceof HttpRequestWrapper) {
         HttpRequestWrapper wrapper = (HttpRequestWrapper) request;
         if (wrapper.getOriginal() instanceof HttpUriRequest) {
            URI original = ((HttpUriRequest) wrapper.getOriginal()).getURI();
            if (original.isAbsolute()) {
               return original.toString();
            }
         }
      }

      HttpHost host = target != null ? target : targetOf(request);
      if (host == null) {
         throw new IllegalStateException("Cannot determine the absolute URL of request to " + uri);
      }
      return host.toURI() + uri;
   }

   @Override
   public byte[] readBody() throws IOException {
      HttpEntity entity = entity();
      if (entity == null) {
         return new byte[0];
      }
      byte[] body = EntityUtils.toByteArray(entity);
      return body != null ? body : new byte[0];
   }

   @Override
   public void replaceBody(byte[] body) {
      if (!(request instanceof HttpEntityEnclosingRequest)) {
         if (body.length > 0) {
            throw new IllegalStateException(getMethod() + " request cannot carry a body");
         }
         return;
      }

      HttpEntityEnclosingRequest enclosingRequest = (HttpEntityEnclosingRequest) request;
      HttpEntity current = enclosingRequest.getEntity();
      if (current == null && body.length == 0) {
         return;
      }
      ByteArrayEntity replacement = new ByteArrayEntity(body);
      if (current != null) {
         replacement.setContentType(current.getContentType());
         replacement.setContentEncoding(current.getContentEncoding());
         replacement.setChunked(current.isChunked());
      }
      enclosingRequest.setEntity(replacement);

      // a wrapper shares its entity with the caller's request, which the read above may have drained
      if (request instanceof HttpRequestWrapper) {
         HttpRequest original = ((HttpRequestWrapper) request).getOriginal();
         if (original instanceof HttpEntityEnclosingRequest) {
            ((HttpEntityEnclosingRequest) original).setEntity(replacement);
         }
      }
   }

   @Override
   public String getHeader(String name) {
      Header header = request.getFirstHeader(name);
      return header != null ? header.getValue() : null;
   }

   @Override
   public void setHeader(String name, String value) {
      request.setHeader(name, value);
   }

   @Override
   public void removeHeader(String name) {
      request.removeHeaders(name);
   }

   @Override
   public List<String> getHeaderNames() {
      List<String> names = new ArrayList<>();
      for (Header header : request.getAllHeaders()) {
         names.add(header.getName());
      }
      return names;
   }

   private HttpEntity entity() {
      return request instanceof HttpEntityEnclosingRequest ? ((HttpEntityEnclosingRequest) request).getEntity() : null;
   }

   private static HttpHost targetOf(HttpRequest request) {
      return request instanceof HttpRequestWrapper ? ((HttpRequestWrapper) request).getTarget() : null;
   }
}
