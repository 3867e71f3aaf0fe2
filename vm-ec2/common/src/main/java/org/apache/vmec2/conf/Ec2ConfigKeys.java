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

package org.apache.vmec2.conf;

/**
 * Configuration keys for the EC2 client handed out with temporary
 * credentials.
 */
public final class Ec2ConfigKeys {

  private Ec2ConfigKeys() {
  }

  public static final String EC2_PREFIX = "ec2.";

  public static final String EC2_CLIENT_PREFIX = EC2_PREFIX + "client.";

  // Endpoint selection
  public static final String EC2_CLIENT_REGION =
      EC2_CLIENT_PREFIX + "region";
  public static final String EC2_CLIENT_REGION_DEFAULT = "us-east-1";

  public static final String EC2_CLIENT_ENDPOINT =
      EC2_CLIENT_PREFIX + "endpoint";
  public static final String EC2_CLIENT_ENDPOINT_DEFAULT = "";

  // Transport tuning passed to the SDK ClientConfiguration
  public static final String EC2_CLIENT_CONNECTION_TIMEOUT =
      EC2_CLIENT_PREFIX + "connection.timeout";
  public static final int EC2_CLIENT_CONNECTION_TIMEOUT_DEFAULT =
      10000; // 10 seconds in milliseconds

  public static final String EC2_CLIENT_SOCKET_TIMEOUT =
      EC2_CLIENT_PREFIX + "socket.timeout";
  public static final int EC2_CLIENT_SOCKET_TIMEOUT_DEFAULT =
      50000; // 50 seconds in milliseconds

  public static final String EC2_CLIENT_MAX_ERROR_RETRY =
      EC2_CLIENT_PREFIX + "max.error.retry";
  public static final int EC2_CLIENT_MAX_ERROR_RETRY_DEFAULT = 3;
}
