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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.regex.Pattern;
import org.apache.vmec2.security.exceptions.CredentialsConfigurationException;
import org.apache.vmec2.security.exceptions.CredentialsDeserializationException;
import org.apache.vmec2.security.exceptions.CredentialsException.ResultCodes;

/**
 * Encodes {@link Credentials} as a versioned record wrapped in MIME
 * base64.
 *
 * <pre>
 *   int     magic          0x45433243 ("EC2C")
 *   byte    format version
 *   byte    field count
 *   field count times:     name, value (strings, CredentialField order)
 *   byte    has endpoint   0 or 1
 *   string  endpoint       when has endpoint is 1
 * </pre>
 *
 * A string is a 4-byte big-endian length followed by that many bytes of
 * UTF-8. Decoding only ever produces strings, and rejects any record
 * that deviates from the layout.
 */
public final class CredentialsCodec {

  public static final int MAGIC = 0x45433243;
  public static final int FORMAT_VERSION = 1;
  public static final int MAX_STRING_LENGTH = 64 * 1024;

  private static final CredentialField[] FIELDS = CredentialField.values();
  private static final Pattern LINE_BREAKS = Pattern.compile("[\r\n]");

  private CredentialsCodec() {
  }

  /**
   * Encode credentials. The attached client is not encoded.
   *
   * @param credentials credentials to encode
   * @return MIME base64 text, in lines of at most 76 characters
   */
  public static String encode(Credentials credentials) {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (DataOutputStream out = new DataOutputStream(bytes)) {
      out.writeInt(MAGIC);
      out.writeByte(FORMAT_VERSION);
      out.writeByte(FIELDS.length);
      for (CredentialField field : FIELDS) {
        writeString(out, field.getCanonicalName());
        writeString(out, credentials.get(field));
      }
      String endpoint = credentials.getEndpoint();
      out.writeBoolean(endpoint != null);
      if (endpoint != null) {
        writeString(out, endpoint);
      }
    } catch (IOException e) {
      // in-memory stream
      throw new UncheckedIOException("Failed to encode credentials", e);
    }
    return Base64.getMimeEncoder().encodeToString(bytes.toByteArray());
  }

  /**
   * Decode the output of {@link #encode(Credentials)}.
   *
   * @param serialized MIME base64 text
   * @return decoded credentials, without an attached client
   * @throws CredentialsDeserializationException if the text does not hold
   *     a credentials record of a supported version
   */
  public static Credentials decode(String serialized)
      throws CredentialsDeserializationException {
    if (serialized == null) {
      throw new CredentialsDeserializationException(
          "Serialized credentials are null", ResultCodes.MALFORMED_ENCODING);
    }

    byte[] data;
    try {
      // only the line separators of the MIME encoder are tolerated
      data = Base64.getDecoder().decode(LINE_BREAKS.matcher(serialized)
          .replaceAll(""));
    } catch (IllegalArgumentException e) {
      throw new CredentialsDeserializationException(
          "Serialized credentials are not valid base64: " + e.getMessage(),
          e, ResultCodes.MALFORMED_ENCODING);
    }

    try (DataInputStream in =
        new DataInputStream(new ByteArrayInputStream(data))) {
      return readRecord(in);
    } catch (CredentialsDeserializationException e) {
      throw e;
    } catch (EOFException e) {
      throw new CredentialsDeserializationException(
          "Serialized credentials are truncated", e,
          ResultCodes.MALFORMED_ENCODING);
    } catch (CharacterCodingException e) {
      throw new CredentialsDeserializationException(
          "Serialized credentials contain invalid UTF-8", e,
          ResultCodes.MALFORMED_ENCODING);
    } catch (IOException e) {
      throw new CredentialsDeserializationException(
          "Failed to read serialized credentials: " + e.getMessage(), e,
          ResultCodes.MALFORMED_ENCODING);
    }
  }

  private static Credentials readRecord(DataInputStream in)
      throws IOException {
    int magic = in.readInt();
    if (magic != MAGIC) {
      throw malformed("Not a serialized credentials record");
    }

    int version = in.readUnsignedByte();
    if (version != FORMAT_VERSION) {
      throw new CredentialsDeserializationException(
          "Unsupported serialized credentials version " + version +
              ", expected " + FORMAT_VERSION,
          ResultCodes.UNSUPPORTED_FORMAT_VERSION);
    }

    int fieldCount = in.readUnsignedByte();
    if (fieldCount != FIELDS.length) {
      throw malformed("Expected " + FIELDS.length + " fields but found " +
          fieldCount);
    }

    Credentials.Builder builder = Credentials.newBuilder();
    for (CredentialField field : FIELDS) {
      String name = readString(in);
      if (!field.getCanonicalName().equals(name)) {
        throw malformed("Expected field " + field.getCanonicalName() +
            " but found " + name);
      }
      builder.set(field, readString(in));
    }

    int hasEndpoint = in.readUnsignedByte();
    if (hasEndpoint == 1) {
      builder.setEndpoint(readString(in));
    } else if (hasEndpoint != 0) {
      throw malformed("Invalid endpoint marker " + hasEndpoint);
    }

    if (in.available() > 0) {
      throw malformed(in.available() + " unexpected trailing bytes");
    }

    try {
      return builder.build();
    } catch (CredentialsConfigurationException e) {
      throw new CredentialsDeserializationException(e.getMessage(), e,
          e.getResult());
    }
  }

  private static void writeString(DataOutputStream out, String value)
      throws IOException {
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length > MAX_STRING_LENGTH) {
      throw new IllegalArgumentException("Credentials value of " +
          bytes.length + " bytes exceeds limit of " + MAX_STRING_LENGTH);
    }
    out.writeInt(bytes.length);
    out.write(bytes);
  }

  private static String readString(DataInputStream in) throws IOException {
    int length = in.readInt();
    if (length < 0 || length > MAX_STRING_LENGTH) {
      throw malformed("Invalid string length " + length);
    }
    byte[] bytes = new byte[length];
    in.readFully(bytes);
    return StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT)
        .decode(ByteBuffer.wrap(bytes))
        .toString();
  }

  private static CredentialsDeserializationException malformed(
      String message) {
    return new CredentialsDeserializationException(message,
        ResultCodes.MALFORMED_ENCODING);
  }
}
