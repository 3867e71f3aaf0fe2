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

import com.amazonaws.auth.AWSSessionCredentials;
import com.amazonaws.services.ec2.AmazonEC2;

/**
 * Builds EC2 clients that authenticate with temporary session
 * credentials.
 */
public interface Ec2ClientFactory {

  /**
   * Create a client whose only credential source is the given session
   * credentials. Static keys present in the options are ignored.
   *
   * @param credentials temporary credentials the client signs with
   * @param options endpoint and region overrides
   * @return new EC2 client
   */
  AmazonEC2 createClient(AWSSessionCredentials credentials,
      Ec2ClientOptions options);
}
