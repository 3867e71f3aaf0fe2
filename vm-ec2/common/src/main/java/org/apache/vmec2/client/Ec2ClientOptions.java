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

package org.apache.vmec2.client;

import java.util.Optional;

/**
 * Options accepted when building an EC2 client from temporary
 * credentials. Static access and secret keys may be supplied for
 * compatibility with long-term credential callers, but factories bound to
 * temporary credentials ignore them.
 */
public final class Ec2ClientOptions {

  private static final Ec2ClientOptions DEFAULTS = newBuilder().build();

  private final String endpoint;
  private final String region;
  private final String accessKey;
  private final String secretKey;

  private Ec2ClientOptions(Builder builder) {
    this.endpoint = builder.endpoint;
    this.region = builder.region;
    this.accessKey = builder.accessKey;
    this.secretKey = builder.secretKey;
  }

  public static Ec2ClientOptions defaults() {
    return DEFAULTS;
  }

  public Optional<String> getEndpoint() {
    return Optional.ofNullable(endpoint);
  }

  public Optional<String> getRegion() {
    return Optional.ofNullable(region);
  }

  public Optional<String> getAccessKey() {
    return Optional.ofNullable(accessKey);
  }

  public Optional<String> getSecretKey() {
    return Optional.ofNullable(secretKey);
  }

  public boolean hasStaticKeys() {
    return accessKey != null || secretKey != null;
  }

  /**
   * Copy of these options with the endpoint set, unless one is set
   * already.
   *
   * @param defaultEndpoint endpoint to use when none is set
   * @return options carrying an endpoint
   */
  public Ec2ClientOptions withDefaultEndpoint(String defaultEndpoint) {
    if (endpoint != null || defaultEndpoint == null) {
      return this;
    }
    return toBuilder().setEndpoint(defaultEndpoint).build();
  }

  public Builder toBuilder() {
    return newBuilder()
        .setEndpoint(endpoint)
        .setRegion(region)
        .setAccessKey(accessKey)
        .setSecretKey(secretKey);
  }

  @Override
  public String toString() {
    return "Ec2ClientOptions{" +
        "endpoint='" + endpoint + '\'' +
        ", region='" + region + '\'' +
        ", staticKeys=" + hasStaticKeys() +
        '}';
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Builder for Ec2ClientOptions.
   */
  public static class Builder {
    private String endpoint;
    private String region;
    private String accessKey;
    private String secretKey;

    public Builder setEndpoint(String endpoint) {
      this.endpoint = emptyToNull(endpoint);
      return this;
    }

    public Builder setRegion(String region) {
      this.region = emptyToNull(region);
      return this;
    }

    public Builder setAccessKey(String accessKey) {
      this.accessKey = emptyToNull(accessKey);
      return this;
    }

    public Builder setSecretKey(String secretKey) {
      this.secretKey = emptyToNull(secretKey);
      return this;
    }

    public Ec2ClientOptions build() {
      return new Ec2ClientOptions(this);
    }

    private static String emptyToNull(String value) {
      if (value == null) {
        return null;
      }
      String trimmed = value.trim();
      return trimmed.isEmpty() ? null : trimmed;
    }
  }
}
