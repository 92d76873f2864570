package io.privy.auth;

import org.apache.http.HttpException;
import org.apache.http.HttpHost;
import org.apache.http.HttpRequest;
import org.apache.http.HttpRequestInterceptor;
import org.apache.http.client.protocol.HttpClientContext;
import org.apache.http.protocol.HttpContext;

import java.io.IOException;

/**
 * Signs every request sent by an HttpClient:
 *
 * <pre>
 * CloseableHttpClient client = HttpClients.custom()
 *       .addInterceptorLast(new AuthorizationSignatureInterceptor(signer))
 *       .build();
 * </pre>
 *
 * Register it last so that headers set by other interceptors are covered by the signature.
 *
 * @author Privy Engineering
 */
public class AuthorizationSignatureInterceptor implements HttpRequestInterceptor {
   private final RequestSigner signer;

   public AuthorizationSignatureInterceptor(RequestSigner signer) {
      this.signer = signer;
   }

   @Override
   public void process(HttpRequest request, HttpContext context) throws HttpException, IOException {
      HttpHost target = HttpClientContext.adapt(context).getTargetHost();
      signer.signRequest(new HttpClientSignableRequest(request, target));
   }
}
