package io.privy.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class CustomFunctionSignerTest {
   public static final String APP_ID = "test_app";
   public static final String TEST_URL = "https://api.privy.io/v1/wallets/wallet_id/rpc";
   private static final ObjectMapper MAPPER = new ObjectMapper();

   private CustomSignFunction signFunction;
   private JsonNode body;
   private SignablePayload payload;

   @Before
   public final void before() throws IOException {
      signFunction = mock(CustomSignFunction.class);
      body = MAPPER.readTree("{\"method\":\"eth_sendTransaction\",\"params\":{\"to\":\"0x123\"}}");
      payload = SignablePayload.of("post", TEST_URL, body, APP_ID);
   }

   @Test
   public final void passesRequestToFunction() throws Exception {
      SignatureResult expected = new SignatureResult("custom_sig", "custom_public_key");
      when(signFunction.sign(anyString(), anyString(), any(JsonNode.class), anyString())).thenReturn(expected);

      SignatureResult result = new CustomFunctionSigner(signFunction).sign(payload);

      assertSame(expected, result);
      verify(signFunction).sign("POST", TEST_URL, body, APP_ID);
   }

   @Test(expected = InvalidSignerResultException.class)
   public final void rejectsMissingResult() throws Exception {
      when(signFunction.sign(anyString(), anyString(), any(JsonNode.class), anyString())).thenReturn(null);
      new CustomFunctionSigner(signFunction).sign(payload);
   }

   @Test(expected = InvalidSignerResultException.class)
   public final void rejectsEmptySignature() throws Exception {
      when(signFunction.sign(anyString(), anyString(), any(JsonNode.class), anyString()))
            .thenReturn(SignatureResult.of(""));
      new CustomFunctionSigner(signFunction).sign(payload);
   }

   @Test(expected = InvalidSignerResultException.class)
   public final void rejectsNullSignature() throws Exception {
      when(signFunction.sign(anyString(), anyString(), any(JsonNode.class), anyString()))
            .thenReturn(new SignatureResult(null, "public_key"));
      new CustomFunctionSigner(signFunction).sign(payload);
   }

   @Test
   public final void reportsFunctionFailure() throws Exception {
      IOException failure = new IOException("KMS unavailable");
      when(signFunction.sign(anyString(), anyString(), any(JsonNode.class), anyString())).thenThrow(failure);

      try {
         new CustomFunctionSigner(signFunction).sign(payload);
         fail("Expected SigningFailedException");
      } catch (SigningFailedException e) {
         assertSame(failure, e.getCause());
         assertEquals(AuthorizationException.NO_STRATEGY, e.getStrategyIndex());
      }
   }

   @Test
   public final void functionCannotAlterSignedBody() {
      CustomSignFunction mutating = (method, url, requestBody, appId) -> {
         ((ObjectNode) requestBody).put("method", "changed");
         return SignatureResult.of("sig");
      };
      String before = payload.canonicalString();

      new CustomFunctionSigner(mutating).sign(payload);

      assertEquals(before, payload.canonicalString());
   }

   @Test(expected = IllegalArgumentException.class)
   public final void requiresFunction() {
      new CustomFunctionSigner(null);
   }
}
