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

import com.amazonaws.auth.AWSSessionCredentials;
import com.amazonaws.services.ec2.AmazonEC2;
import com.google.common.base.Preconditions;
import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import org.apache.vmec2.client.AwsSdkEc2ClientFactory;
import org.apache.vmec2.client.Ec2ClientFactory;
import org.apache.vmec2.client.Ec2ClientOptions;
import org.apache.vmec2.security.exceptions.CredentialsConfigurationException;
import org.apache.vmec2.security.exceptions.CredentialsDeserializationException;
import org.apache.vmec2.security.exceptions.CredentialsException.ResultCodes;
import org.apache.vmec2.security.exceptions.CredentialsParseException;
import org.apache.vmec2.security.model.InstanceMetadataCredentials;

/**
 * Temporary EC2 security credentials, as returned by the federation token
 * and session token APIs or by the instance metadata of an instance with
 * an IAM role.
 *
 * <p>The four fields are fixed at construction. The expiration is kept as
 * the provider formatted it; callers compare it to the current time
 * before trusting the credentials.
 *
 * <p>Each field has one typed getter, e.g. {@link #getAccessKeyId()}.
 * The other spellings of a field name ({@code accessKeyId},
 * {@code access_key_id}) are only reachable through {@link #get(String)}.
 *
 * <p>Credentials can be handed to another principal as a string with
 * {@link #serialize()} and rebuilt with {@link #deserialize(String)}. The
 * serialized form contains the secret access key and session token
 * unencrypted, so it must travel over a confidential channel.
 *
 * <p>A client built with {@link #newClient()} or
 * {@link #fromJson(String, String)} is remembered. Only the first client
 * is kept; later ones are returned to their callers but not attached.
 */
public final class Credentials implements AWSSessionCredentials {

  private final String accessKeyId;
  private final String secretAccessKey;
  private final String sessionToken;
  private final String expiration;
  private final String endpoint;
  private final AtomicReference<AmazonEC2> client = new AtomicReference<>();

  private Credentials(Builder builder) {
    this.accessKeyId = builder.accessKeyId;
    this.secretAccessKey = builder.secretAccessKey;
    this.sessionToken = builder.sessionToken;
    this.expiration = builder.expiration;
    this.endpoint = builder.endpoint;
  }

  /**
   * Build credentials from the field mapping returned by a federation or
   * session token call.
   *
   * @param fields exactly the four credential fields, under any spelling
   * @return credentials
   * @throws CredentialsConfigurationException on unknown, duplicate,
   *     missing or empty fields
   */
  public static Credentials fromFields(Map<String, String> fields)
      throws CredentialsConfigurationException {
    return fromFields(fields, null);
  }

  /**
   * Build credentials from a field mapping and attach an existing client.
   *
   * @param fields exactly the four credential fields, under any spelling
   * @param ec2 client to attach, may be null
   * @return credentials
   * @throws CredentialsConfigurationException on unknown, duplicate,
   *     missing or empty fields
   */
  public static Credentials fromFields(Map<String, String> fields,
      AmazonEC2 ec2) throws CredentialsConfigurationException {
    Preconditions.checkNotNull(fields, "fields cannot be null");

    Builder builder = newBuilder();
    Set<CredentialField> seen = EnumSet.noneOf(CredentialField.class);
    for (Map.Entry<String, String> entry : fields.entrySet()) {
      String name = entry.getKey();
      CredentialField field = CredentialField.forName(name)
          .orElseThrow(() -> new CredentialsConfigurationException(
              "Unrecognized credentials field: " + name,
              ResultCodes.UNKNOWN_FIELD));
      if (!seen.add(field)) {
        throw new CredentialsConfigurationException(
            "Credentials field " + field.getCanonicalName() +
                " given more than once", ResultCodes.DUPLICATE_FIELD);
      }
      String value = entry.getValue();
      if (value == null || value.isEmpty()) {
        throw new CredentialsConfigurationException(
            "Credentials field " + field.getCanonicalName() + " is empty",
            ResultCodes.EMPTY_FIELD);
      }
      builder.set(field, value);
    }

    Credentials credentials = builder.build();
    if (ec2 != null) {
      credentials.attachClient(ec2);
    }
    return credentials;
  }

  /**
   * Rebuild credentials from the output of {@link #serialize()}.
   *
   * @param serialized serialized credentials
   * @return credentials equal to the serialized ones
   * @throws CredentialsDeserializationException if the text is not a
   *     serialized credentials record
   */
  public static Credentials deserialize(String serialized)
      throws CredentialsDeserializationException {
    return CredentialsCodec.decode(serialized);
  }

  /**
   * Build credentials from instance metadata JSON and attach a client
   * bound to the regional or configured endpoint.
   *
   * @param json instance metadata security credentials document
   * @return credentials with an attached client
   * @throws CredentialsParseException on invalid JSON or missing fields
   */
  public static Credentials fromJson(String json)
      throws CredentialsParseException {
    return fromJson(json, null);
  }

  /**
   * Build credentials from instance metadata JSON and attach a client
   * bound to the given endpoint.
   *
   * @param json instance metadata security credentials document
   * @param endpoint endpoint of the attached client, may be null
   * @return credentials with an attached client
   * @throws CredentialsParseException on invalid JSON or missing fields
   */
  public static Credentials fromJson(String json, String endpoint)
      throws CredentialsParseException {
    return fromJson(json, endpoint, defaultClientFactory());
  }

  public static Credentials fromJson(String json, String endpoint,
      Ec2ClientFactory clientFactory) throws CredentialsParseException {
    Preconditions.checkNotNull(clientFactory, "clientFactory cannot be null");
    InstanceMetadataCredentials metadata =
        InstanceMetadataCredentials.parse(json);

    Credentials credentials;
    try {
      // metadata calls the session token "Token"
      credentials = newBuilder()
          .setAccessKeyId(metadata.getAccessKeyId())
          .setSecretAccessKey(metadata.getSecretAccessKey())
          .setSessionToken(metadata.getToken())
          .setExpiration(metadata.getExpiration())
          .setEndpoint(endpoint)
          .build();
    } catch (CredentialsConfigurationException e) {
      ResultCodes result = e.getResult() == ResultCodes.FIELD_TOO_LONG ?
          ResultCodes.FIELD_TOO_LONG : ResultCodes.MISSING_FIELD;
      throw new CredentialsParseException(e.getMessage(), e, result);
    }

    credentials.newClient(Ec2ClientOptions.defaults(), clientFactory);
    return credentials;
  }

  public String getAccessKeyId() {
    return accessKeyId;
  }

  public String getSecretAccessKey() {
    return secretAccessKey;
  }

  @Override
  public String getSessionToken() {
    return sessionToken;
  }

  public String getExpiration() {
    return expiration;
  }

  @Override
  public String getAWSAccessKeyId() {
    return accessKeyId;
  }

  @Override
  public String getAWSSecretKey() {
    return secretAccessKey;
  }

  /**
   * Endpoint the credentials were obtained for, if any. Used as the
   * default endpoint of clients built from these credentials.
   *
   * @return endpoint or null
   */
  public String getEndpoint() {
    return endpoint;
  }

  /**
   * Look up a field by any of its spellings, e.g. {@code accessKeyId},
   * {@code access_key_id} or {@code AccessKeyId}.
   *
   * @param name field name
   * @return field value
   * @throws IllegalArgumentException if the name is not a field name
   */
  public String get(String name) {
    CredentialField field = CredentialField.forName(name)
        .orElseThrow(() -> new IllegalArgumentException(
            "Unknown credentials field: " + name));
    return get(field);
  }

  public String get(CredentialField field) {
    Preconditions.checkNotNull(field, "field cannot be null");
    switch (field) {
    case ACCESS_KEY_ID:
      return accessKeyId;
    case SECRET_ACCESS_KEY:
      return secretAccessKey;
    case SESSION_TOKEN:
      return sessionToken;
    case EXPIRATION:
      return expiration;
    default:
      throw new IllegalArgumentException("Unsupported field: " + field);
    }
  }

  /**
   * Serialize to a base64 string suitable for SSL, S/MIME or another
   * text channel. The attached client is not part of the serialized form.
   *
   * @return serialized credentials
   */
  public String serialize() {
    return CredentialsCodec.encode(this);
  }

  public AmazonEC2 newClient() {
    return newClient(Ec2ClientOptions.defaults());
  }

  public AmazonEC2 newClient(Ec2ClientOptions options) {
    return newClient(options, defaultClientFactory());
  }

  /**
   * Build an EC2 client that authenticates with these credentials. Access
   * and secret keys in the options are ignored. Without an endpoint in
   * the options, the endpoint of these credentials is used. The client is
   * attached when no client is attached yet.
   *
   * @param options client options, may be null
   * @param clientFactory factory building the client
   * @return the new client
   */
  public AmazonEC2 newClient(Ec2ClientOptions options,
      Ec2ClientFactory clientFactory) {
    Preconditions.checkNotNull(clientFactory, "clientFactory cannot be null");
    Ec2ClientOptions effective =
        (options != null ? options : Ec2ClientOptions.defaults())
            .withDefaultEndpoint(endpoint);
    AmazonEC2 created = clientFactory.createClient(this, effective);
    attachClient(created);
    return created;
  }

  /**
   * Attach a client unless one is attached already.
   *
   * @param ec2 client to attach
   * @return the attached client, which is the existing one if present
   */
  public AmazonEC2 attachClient(AmazonEC2 ec2) {
    Preconditions.checkNotNull(ec2, "client cannot be null");
    client.compareAndSet(null, ec2);
    return client.get();
  }

  public Optional<AmazonEC2> getClient() {
    return Optional.ofNullable(client.get());
  }

  /**
   * Human readable label for these credentials, the access key ID.
   *
   * @return access key ID
   */
  public String shortName() {
    return accessKeyId;
  }

  /**
   * The session token, the text these credentials stand for when pasted
   * into a request. Not used by {@link #toString()}.
   *
   * @return session token
   */
  public String display() {
    return sessionToken;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Credentials that = (Credentials) o;
    return Objects.equals(accessKeyId, that.accessKeyId) &&
        Objects.equals(secretAccessKey, that.secretAccessKey) &&
        Objects.equals(sessionToken, that.sessionToken) &&
        Objects.equals(expiration, that.expiration);
  }

  @Override
  public int hashCode() {
    return Objects.hash(accessKeyId, secretAccessKey, sessionToken,
        expiration);
  }

  @Override
  public String toString() {
    return "Credentials{" +
        "accessKeyId='" + accessKeyId + '\'' +
        ", expiration='" + expiration + '\'' +
        ", endpoint='" + endpoint + '\'' +
        '}';
  }

  private static Ec2ClientFactory defaultClientFactory() {
    return DefaultClientFactoryHolder.INSTANCE;
  }

  private static final class DefaultClientFactoryHolder {
    private static final Ec2ClientFactory INSTANCE =
        new AwsSdkEc2ClientFactory();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Builder for Credentials.
   */
  public static class Builder {
    private String accessKeyId;
    private String secretAccessKey;
    private String sessionToken;
    private String expiration;
    private String endpoint;

    public Builder setAccessKeyId(String accessKeyId) {
      this.accessKeyId = accessKeyId;
      return this;
    }

    public Builder setSecretAccessKey(String secretAccessKey) {
      this.secretAccessKey = secretAccessKey;
      return this;
    }

    public Builder setSessionToken(String sessionToken) {
      this.sessionToken = sessionToken;
      return this;
    }

    public Builder setExpiration(String expiration) {
      this.expiration = expiration;
      return this;
    }

    public Builder setEndpoint(String endpoint) {
      String trimmed = endpoint == null ? null : endpoint.trim();
      this.endpoint = trimmed == null || trimmed.isEmpty() ? null : trimmed;
      return this;
    }

    public Builder set(CredentialField field, String value) {
      Preconditions.checkNotNull(field, "field cannot be null");
      switch (field) {
      case ACCESS_KEY_ID:
        return setAccessKeyId(value);
      case SECRET_ACCESS_KEY:
        return setSecretAccessKey(value);
      case SESSION_TOKEN:
        return setSessionToken(value);
      case EXPIRATION:
        return setExpiration(value);
      default:
        throw new IllegalArgumentException("Unsupported field: " + field);
      }
    }

    public Credentials build() throws CredentialsConfigurationException {
      requireNonEmpty(CredentialField.ACCESS_KEY_ID, accessKeyId);
      requireNonEmpty(CredentialField.SECRET_ACCESS_KEY, secretAccessKey);
      requireNonEmpty(CredentialField.SESSION_TOKEN, sessionToken);
      requireNonEmpty(CredentialField.EXPIRATION, expiration);
      if (endpoint != null) {
        requireEncodable("Endpoint", endpoint);
      }
      return new Credentials(this);
    }

    private static void requireNonEmpty(CredentialField field, String value)
        throws CredentialsConfigurationException {
      if (value == null) {
        throw new CredentialsConfigurationException(
            "Missing credentials field: " + field.getCanonicalName(),
            ResultCodes.MISSING_FIELD);
      }
      if (value.isEmpty()) {
        throw new CredentialsConfigurationException(
            "Credentials field " + field.getCanonicalName() + " is empty",
            ResultCodes.EMPTY_FIELD);
      }
      requireEncodable(field.getCanonicalName(), value);
    }

    // every value must fit a string of the serialized form
    private static void requireEncodable(String name, String value)
        throws CredentialsConfigurationException {
      int length = value.getBytes(StandardCharsets.UTF_8).length;
      if (length > CredentialsCodec.MAX_STRING_LENGTH) {
        throw new CredentialsConfigurationException(
            "Credentials field " + name + " is " + length +
                " bytes, limit is " + CredentialsCodec.MAX_STRING_LENGTH,
            ResultCodes.FIELD_TOO_LONG);
      }
    }
  }
}
