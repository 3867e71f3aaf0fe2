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

package org.apache.vmec2.security.exceptions;

import java.io.IOException;

/**
 * Base class of the failures raised while building, decoding or parsing
 * temporary credentials. Every instance carries a {@link ResultCodes}
 * value identifying the failing step.
 */
public class CredentialsException extends IOException {

  private static final long serialVersionUID = 1L;

  private final ResultCodes result;

  public CredentialsException(String message, ResultCodes result) {
    super(message);
    this.result = result;
  }

  public CredentialsException(String message, Throwable cause,
      ResultCodes result) {
    super(message, cause);
    this.result = result;
  }

  public ResultCodes getResult() {
    return result;
  }

  @Override
  public String toString() {
    return result + " " + super.toString();
  }

  /**
   * Failure categories.
   */
  public enum ResultCodes {
    UNKNOWN_FIELD,
    DUPLICATE_FIELD,
    MISSING_FIELD,
    EMPTY_FIELD,
    FIELD_TOO_LONG,
    MALFORMED_ENCODING,
    UNSUPPORTED_FORMAT_VERSION,
    INVALID_JSON,
    METADATA_ERROR
  }
}
