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

package org.apache.vmec2.security.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.apache.vmec2.security.exceptions.CredentialsException.ResultCodes;
import org.apache.vmec2.security.exceptions.CredentialsParseException;

/**
 * Security credentials document served by instance metadata at
 * {@code /latest/meta-data/iam/security-credentials/<role>}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class InstanceMetadataCredentials {

  public static final String SUCCESS_CODE = "Success";

  private static final ObjectReader READER = new ObjectMapper()
      .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
      .readerFor(InstanceMetadataCredentials.class);

  @JsonProperty("Code")
  private String code;

  @JsonProperty("LastUpdated")
  private String lastUpdated;

  @JsonProperty("Type")
  private String type;

  @JsonProperty("AccessKeyId")
  private String accessKeyId;

  @JsonProperty("SecretAccessKey")
  private String secretAccessKey;

  @JsonProperty("Token")
  private String token;

  @JsonProperty("Expiration")
  private String expiration;

  public InstanceMetadataCredentials() {
  }

  /**
   * Parse and check a credentials document.
   *
   * @param json document text
   * @return parsed document with all credential fields present
   * @throws CredentialsParseException if the text is not a JSON object,
   *     a credential field is missing or empty, or the document reports
   *     a failure code
   */
  public static InstanceMetadataCredentials parse(String json)
      throws CredentialsParseException {
    if (json == null) {
      throw new CredentialsParseException(
          "Instance metadata credentials JSON is null",
          ResultCodes.INVALID_JSON);
    }

    InstanceMetadataCredentials metadata;
    try {
      metadata = READER.readValue(json);
    } catch (JsonProcessingException e) {
      throw new CredentialsParseException(
          "Invalid instance metadata credentials JSON: " +
              e.getOriginalMessage(), e, ResultCodes.INVALID_JSON);
    }
    if (metadata == null) {
      throw new CredentialsParseException(
          "Instance metadata credentials JSON is not an object",
          ResultCodes.INVALID_JSON);
    }

    if (metadata.code != null && !SUCCESS_CODE.equals(metadata.code)) {
      throw new CredentialsParseException(
          "Instance metadata reported credentials code " + metadata.code,
          ResultCodes.METADATA_ERROR);
    }

    requirePresent("AccessKeyId", metadata.accessKeyId);
    requirePresent("SecretAccessKey", metadata.secretAccessKey);
    requirePresent("Token", metadata.token);
    requirePresent("Expiration", metadata.expiration);
    return metadata;
  }

  private static void requirePresent(String name, String value)
      throws CredentialsParseException {
    if (value == null || value.isEmpty()) {
      throw new CredentialsParseException(
          "Instance metadata credentials JSON lacks field " + name,
          ResultCodes.MISSING_FIELD);
    }
  }

  public String getCode() {
    return code;
  }

  public void setCode(String code) {
    this.code = code;
  }

  public String getLastUpdated() {
    return lastUpdated;
  }

  public void setLastUpdated(String lastUpdated) {
    this.lastUpdated = lastUpdated;
  }

  public String getType() {
    return type;
  }

  public void setType(String type) {
    this.type = type;
  }

  public String getAccessKeyId() {
    return accessKeyId;
  }

  public void setAccessKeyId(String accessKeyId) {
    this.accessKeyId = accessKeyId;
  }

  public String getSecretAccessKey() {
    return secretAccessKey;
  }

  public void setSecretAccessKey(String secretAccessKey) {
    this.secretAccessKey = secretAccessKey;
  }

  public String getToken() {
    return token;
  }

  public void setToken(String token) {
    this.token = token;
  }

  public String getExpiration() {
    return expiration;
  }

  public void setExpiration(String expiration) {
    this.expiration = expiration;
  }
}
