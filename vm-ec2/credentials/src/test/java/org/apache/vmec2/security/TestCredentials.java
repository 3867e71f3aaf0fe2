/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License. You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.vmec2.security;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.amazonaws.services.ec2.AmazonEC2;
import com.google.common.base.Strings;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.vmec2.client.Ec2ClientFactory;
import org.apache.vmec2.client.Ec2ClientOptions;
import org.apache.vmec2.security.exceptions.CredentialsConfigurationException;
import org.apache.vmec2.security.exceptions.CredentialsException.ResultCodes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

/**
 * Unit tests for Credentials.
 */
public class TestCredentials {

  private Map<String, String> fields;

  @BeforeEach
  public void setup() {
    fields = new LinkedHashMap<>();
    fields.put("AccessKeyId", "AKIA123");
    fields.put("SecretAccessKey", "secret");
    fields.put("SessionToken", "tok");
    fields.put("Expiration", "2025-01-01T00:00:00Z");
  }

  @Test
  public void testFromFields() throws Exception {
    Credentials credentials = Credentials.fromFields(fields);

    assertEquals("AKIA123", credentials.getAccessKeyId());
    assertEquals("secret", credentials.getSecretAccessKey());
    assertEquals("tok", credentials.getSessionToken());
    assertEquals("2025-01-01T00:00:00Z", credentials.getExpiration());
    assertEquals("AKIA123", credentials.shortName());
    assertNull(credentials.getEndpoint());
    assertFalse(credentials.getClient().isPresent());
  }

  @Test
  public void testSdkAccessorsMatch() throws Exception {
    Credentials credentials = Credentials.fromFields(fields);

    assertEquals(credentials.getAccessKeyId(),
        credentials.getAWSAccessKeyId());
    assertEquals(credentials.getSecretAccessKey(),
        credentials.getAWSSecretKey());
  }

  @Test
  public void testAliasSpellingsReturnSameValue() throws Exception {
    Credentials credentials = Credentials.fromFields(fields);

    for (CredentialField field : CredentialField.values()) {
      String camel = credentials.get(field.getCamelCaseName());
      String underscore = credentials.get(field.getUnderscoreName());
      String canonical = credentials.get(field.getCanonicalName());
      assertEquals(camel, underscore);
      assertEquals(camel, canonical);
      assertEquals(camel, credentials.get(field));
    }
    assertEquals("AKIA123", credentials.get("access_key_id"));
    assertEquals("tok", credentials.get("sessionToken"));
  }

  @Test
  public void testGetUnknownFieldName() throws Exception {
    Credentials credentials = Credentials.fromFields(fields);

    assertThrows(IllegalArgumentException.class,
        () -> credentials.get("federatedUser"));
  }

  @Test
  public void testFromFieldsAcceptsAliasKeys() throws Exception {
    Map<String, String> aliased = new HashMap<>();
    aliased.put("access_key_id", "AKIA123");
    aliased.put("secretAccessKey", "secret");
    aliased.put("session_token", "tok");
    aliased.put("expiration", "2025-01-01T00:00:00Z");

    assertEquals(Credentials.fromFields(fields),
        Credentials.fromFields(aliased));
  }

  @Test
  public void testUnknownFieldRejected() {
    Map<String, String> bad = new HashMap<>();
    bad.put("Foo", "bar");

    CredentialsConfigurationException e = assertThrows(
        CredentialsConfigurationException.class,
        () -> Credentials.fromFields(bad));
    assertEquals(ResultCodes.UNKNOWN_FIELD, e.getResult());
    assertTrue(e.getMessage().contains("Foo"));
  }

  @Test
  public void testExtraFieldRejected() {
    fields.put("FederatedUser", "someone");

    CredentialsConfigurationException e = assertThrows(
        CredentialsConfigurationException.class,
        () -> Credentials.fromFields(fields));
    assertEquals(ResultCodes.UNKNOWN_FIELD, e.getResult());
  }

  @Test
  public void testMissingFieldRejected() {
    fields.remove("SessionToken");

    CredentialsConfigurationException e = assertThrows(
        CredentialsConfigurationException.class,
        () -> Credentials.fromFields(fields));
    assertEquals(ResultCodes.MISSING_FIELD, e.getResult());
    assertTrue(e.getMessage().contains("SessionToken"));
  }

  @Test
  public void testEmptyFieldRejected() {
    fields.put("SecretAccessKey", "");

    CredentialsConfigurationException e = assertThrows(
        CredentialsConfigurationException.class,
        () -> Credentials.fromFields(fields));
    assertEquals(ResultCodes.EMPTY_FIELD, e.getResult());

    fields.put("SecretAccessKey", null);
    e = assertThrows(CredentialsConfigurationException.class,
        () -> Credentials.fromFields(fields));
    assertEquals(ResultCodes.EMPTY_FIELD, e.getResult());
  }

  @Test
  public void testOversizedFieldRejected() {
    fields.put("SessionToken",
        repeat('x', CredentialsCodec.MAX_STRING_LENGTH + 1));

    CredentialsConfigurationException e = assertThrows(
        CredentialsConfigurationException.class,
        () -> Credentials.fromFields(fields));
    assertEquals(ResultCodes.FIELD_TOO_LONG, e.getResult());
    assertTrue(e.getMessage().contains("SessionToken"));
  }

  @Test
  public void testMultiByteFieldMeasuredInBytes() {
    // two UTF-8 bytes per character
    fields.put("SecretAccessKey",
        repeat('é', CredentialsCodec.MAX_STRING_LENGTH / 2 + 1));

    CredentialsConfigurationException e = assertThrows(
        CredentialsConfigurationException.class,
        () -> Credentials.fromFields(fields));
    assertEquals(ResultCodes.FIELD_TOO_LONG, e.getResult());
  }

  @Test
  public void testOversizedEndpointRejected() {
    CredentialsConfigurationException e = assertThrows(
        CredentialsConfigurationException.class,
        () -> Credentials.newBuilder()
            .setAccessKeyId("AKIA123")
            .setSecretAccessKey("secret")
            .setSessionToken("tok")
            .setExpiration("2025-01-01T00:00:00Z")
            .setEndpoint("http://" +
                repeat('h', CredentialsCodec.MAX_STRING_LENGTH))
            .build());
    assertEquals(ResultCodes.FIELD_TOO_LONG, e.getResult());
  }

  @Test
  public void testBlankEndpointIgnored() throws Exception {
    Credentials credentials = Credentials.newBuilder()
        .setAccessKeyId("AKIA123")
        .setSecretAccessKey("secret")
        .setSessionToken("tok")
        .setExpiration("2025-01-01T00:00:00Z")
        .setEndpoint("   ")
        .build();
    assertNull(credentials.getEndpoint());

    Credentials padded = Credentials.newBuilder()
        .setAccessKeyId("AKIA123")
        .setSecretAccessKey("secret")
        .setSessionToken("tok")
        .setExpiration("2025-01-01T00:00:00Z")
        .setEndpoint(" http://localhost:8773\n")
        .build();
    assertEquals("http://localhost:8773", padded.getEndpoint());
  }

  @Test
  public void testDuplicateSpellingRejected() {
    fields.put("access_key_id", "AKIA456");

    CredentialsConfigurationException e = assertThrows(
        CredentialsConfigurationException.class,
        () -> Credentials.fromFields(fields));
    assertEquals(ResultCodes.DUPLICATE_FIELD, e.getResult());
  }

  @Test
  public void testBuilderRequiresAllFields() {
    CredentialsConfigurationException e = assertThrows(
        CredentialsConfigurationException.class,
        () -> Credentials.newBuilder()
            .setAccessKeyId("AKIA123")
            .setSecretAccessKey("secret")
            .setSessionToken("tok")
            .build());
    assertEquals(ResultCodes.MISSING_FIELD, e.getResult());
    assertTrue(e.getMessage().contains("Expiration"));
  }

  @Test
  public void testToStringHidesSecrets() throws Exception {
    Credentials credentials = Credentials.fromFields(fields);

    String rendered = credentials.toString();
    assertTrue(rendered.contains("AKIA123"));
    assertFalse(rendered.contains("secret"));
    assertFalse(rendered.contains("tok'"));
    assertEquals("tok", credentials.display());
  }

  @Test
  public void testEquality() throws Exception {
    Credentials first = Credentials.fromFields(fields);
    Credentials second = Credentials.fromFields(new HashMap<>(fields));

    assertEquals(first, second);
    assertEquals(first.hashCode(), second.hashCode());

    fields.put("Expiration", "2025-01-01T01:00:00Z");
    assertNotEquals(first, Credentials.fromFields(fields));
  }

  @Test
  public void testClientAttachedAtConstruction() throws Exception {
    AmazonEC2 ec2 = mock(AmazonEC2.class);

    Credentials credentials = Credentials.fromFields(fields, ec2);

    assertSame(ec2, credentials.getClient().get());
  }

  @Test
  public void testAttachKeepsExistingClient() throws Exception {
    AmazonEC2 first = mock(AmazonEC2.class);
    AmazonEC2 second = mock(AmazonEC2.class);
    Credentials credentials = Credentials.fromFields(fields);

    assertSame(first, credentials.attachClient(first));
    assertSame(first, credentials.attachClient(second));
    assertSame(first, credentials.getClient().get());
  }

  @Test
  public void testNewClientUsesCredentialsAsSource() throws Exception {
    AmazonEC2 ec2 = mock(AmazonEC2.class);
    Ec2ClientFactory factory = mock(Ec2ClientFactory.class);
    when(factory.createClient(any(), any())).thenReturn(ec2);
    Credentials credentials = Credentials.fromFields(fields);

    Ec2ClientOptions options = Ec2ClientOptions.newBuilder()
        .setEndpoint("https://ec2.eu-west-1.amazonaws.com")
        .setAccessKey("AKIDSTATIC")
        .setSecretKey("static-secret")
        .build();
    AmazonEC2 client = credentials.newClient(options, factory);

    assertSame(ec2, client);
    assertSame(ec2, credentials.getClient().get());
    ArgumentCaptor<Ec2ClientOptions> captor =
        ArgumentCaptor.forClass(Ec2ClientOptions.class);
    verify(factory).createClient(same(credentials), captor.capture());
    assertEquals("https://ec2.eu-west-1.amazonaws.com",
        captor.getValue().getEndpoint().get());
  }

  @Test
  public void testNewClientDoesNotReplaceAttachedClient() throws Exception {
    AmazonEC2 attached = mock(AmazonEC2.class);
    AmazonEC2 created = mock(AmazonEC2.class);
    Ec2ClientFactory factory = mock(Ec2ClientFactory.class);
    when(factory.createClient(any(), any())).thenReturn(created);
    Credentials credentials = Credentials.fromFields(fields, attached);

    AmazonEC2 client = credentials.newClient(null, factory);

    assertSame(created, client);
    assertSame(attached, credentials.getClient().get());
  }

  @Test
  public void testNewClientDefaultsToCredentialsEndpoint() throws Exception {
    Ec2ClientFactory factory = mock(Ec2ClientFactory.class);
    when(factory.createClient(any(), any()))
        .thenReturn(mock(AmazonEC2.class));
    Credentials credentials = Credentials.newBuilder()
        .setAccessKeyId("AKIA123")
        .setSecretAccessKey("secret")
        .setSessionToken("tok")
        .setExpiration("2025-01-01T00:00:00Z")
        .setEndpoint("http://localhost:8773")
        .build();

    credentials.newClient(Ec2ClientOptions.defaults(), factory);

    ArgumentCaptor<Ec2ClientOptions> captor =
        ArgumentCaptor.forClass(Ec2ClientOptions.class);
    verify(factory).createClient(same(credentials), captor.capture());
    assertEquals("http://localhost:8773",
        captor.getValue().getEndpoint().get());
  }

  @Test
  public void testNewClientWithDefaultFactory() throws Exception {
    Credentials credentials = Credentials.fromFields(fields);

    AmazonEC2 client = credentials.newClient();

    assertSame(client, credentials.getClient().get());
    client.shutdown();
  }

  private static String repeat(char c, int count) {
    return Strings.repeat(String.valueOf(c), count);
  }
}
