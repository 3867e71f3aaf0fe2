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

import com.google.common.collect.ImmutableMap;
import java.util.Optional;

/**
 * The fields of a set of temporary credentials. Each field is known by
 * its canonical name, as returned by the federation and session token
 * APIs, and by a camel-case and an underscore-separated alias.
 */
public enum CredentialField {

  ACCESS_KEY_ID("AccessKeyId", "accessKeyId", "access_key_id"),
  SECRET_ACCESS_KEY("SecretAccessKey", "secretAccessKey",
      "secret_access_key"),
  SESSION_TOKEN("SessionToken", "sessionToken", "session_token"),
  EXPIRATION("Expiration", "expiration", "expiration");

  private static final ImmutableMap<String, CredentialField> BY_NAME;

  static {
    ImmutableMap.Builder<String, CredentialField> builder =
        ImmutableMap.builder();
    for (CredentialField field : values()) {
      builder.put(field.canonicalName, field);
      builder.put(field.camelCaseName, field);
      if (!field.underscoreName.equals(field.camelCaseName)) {
        builder.put(field.underscoreName, field);
      }
    }
    BY_NAME = builder.build();
  }

  private final String canonicalName;
  private final String camelCaseName;
  private final String underscoreName;

  CredentialField(String canonicalName, String camelCaseName,
      String underscoreName) {
    this.canonicalName = canonicalName;
    this.camelCaseName = camelCaseName;
    this.underscoreName = underscoreName;
  }

  public String getCanonicalName() {
    return canonicalName;
  }

  public String getCamelCaseName() {
    return camelCaseName;
  }

  public String getUnderscoreName() {
    return underscoreName;
  }

  /**
   * Resolve a field from any of its spellings.
   *
   * @param name canonical, camel-case or underscore name
   * @return the field, or empty if the name is not recognized
   */
  public static Optional<CredentialField> forName(String name) {
    if (name == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(BY_NAME.get(name));
  }
}
