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

import com.amazonaws.ClientConfiguration;
import com.amazonaws.auth.AWSSessionCredentials;
import com.amazonaws.auth.AWSStaticCredentialsProvider;
import com.amazonaws.client.builder.AwsClientBuilder.EndpointConfiguration;
import com.amazonaws.services.ec2.AmazonEC2;
import com.amazonaws.services.ec2.AmazonEC2ClientBuilder;
import com.google.common.base.Preconditions;
import org.apache.hadoop.conf.Configuration;
import org.apache.vmec2.conf.Ec2ConfigKeys;
import org.apache.vmec2.conf.Ec2Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link Ec2ClientFactory} backed by the AWS SDK for Java.
 */
public class AwsSdkEc2ClientFactory implements Ec2ClientFactory {

  private static final Logger LOG =
      LoggerFactory.getLogger(AwsSdkEc2ClientFactory.class);

  private final String defaultRegion;
  private final String defaultEndpoint;
  private final int connectionTimeout;
  private final int socketTimeout;
  private final int maxErrorRetry;

  public AwsSdkEc2ClientFactory() {
    this(new Ec2Configuration());
  }

  public AwsSdkEc2ClientFactory(Configuration conf) {
    Ec2Configuration config = Ec2Configuration.of(conf);
    this.defaultRegion = config.getNonBlank(
        Ec2ConfigKeys.EC2_CLIENT_REGION,
        Ec2ConfigKeys.EC2_CLIENT_REGION_DEFAULT);
    this.defaultEndpoint = config.getNonBlank(
        Ec2ConfigKeys.EC2_CLIENT_ENDPOINT,
        Ec2ConfigKeys.EC2_CLIENT_ENDPOINT_DEFAULT);
    this.connectionTimeout = config.getInt(
        Ec2ConfigKeys.EC2_CLIENT_CONNECTION_TIMEOUT,
        Ec2ConfigKeys.EC2_CLIENT_CONNECTION_TIMEOUT_DEFAULT);
    this.socketTimeout = config.getInt(
        Ec2ConfigKeys.EC2_CLIENT_SOCKET_TIMEOUT,
        Ec2ConfigKeys.EC2_CLIENT_SOCKET_TIMEOUT_DEFAULT);
    this.maxErrorRetry = config.getInt(
        Ec2ConfigKeys.EC2_CLIENT_MAX_ERROR_RETRY,
        Ec2ConfigKeys.EC2_CLIENT_MAX_ERROR_RETRY_DEFAULT);
  }

  @Override
  public AmazonEC2 createClient(AWSSessionCredentials credentials,
      Ec2ClientOptions options) {
    Preconditions.checkNotNull(credentials, "credentials cannot be null");
    Ec2ClientOptions effective =
        options != null ? options : Ec2ClientOptions.defaults();

    if (effective.hasStaticKeys()) {
      LOG.debug("Ignoring static access key and secret key options, " +
          "client for {} uses its session credentials",
          credentials.getAWSAccessKeyId());
    }

    String region = resolveRegion(effective);
    String endpoint = resolveEndpoint(effective);

    AmazonEC2ClientBuilder builder = AmazonEC2ClientBuilder.standard()
        .withCredentials(new AWSStaticCredentialsProvider(credentials))
        .withClientConfiguration(newClientConfiguration());

    if (endpoint.isEmpty()) {
      builder.withRegion(region);
    } else {
      builder.withEndpointConfiguration(
          new EndpointConfiguration(endpoint, region));
    }

    LOG.debug("Creating EC2 client for access key: {}, endpoint: {}, " +
        "region: {}", credentials.getAWSAccessKeyId(),
        endpoint.isEmpty() ? "<regional>" : endpoint, region);
    return builder.build();
  }

  /**
   * Region used for the given options: options first, then configuration.
   *
   * @param options client options
   * @return signing region
   */
  public String resolveRegion(Ec2ClientOptions options) {
    return options.getRegion().orElse(defaultRegion);
  }

  /**
   * Endpoint used for the given options: options first, then
   * configuration. Empty means the regional endpoint.
   *
   * @param options client options
   * @return endpoint, possibly empty
   */
  public String resolveEndpoint(Ec2ClientOptions options) {
    return options.getEndpoint().orElse(defaultEndpoint);
  }

  ClientConfiguration newClientConfiguration() {
    return new ClientConfiguration()
        .withConnectionTimeout(connectionTimeout)
        .withSocketTimeout(socketTimeout)
        .withMaxErrorRetry(maxErrorRetry);
  }
}
