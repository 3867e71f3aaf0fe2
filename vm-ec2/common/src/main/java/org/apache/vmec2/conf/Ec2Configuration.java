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

import org.apache.hadoop.conf.Configuration;

/**
 * Configuration for the VM EC2 modules. Loads {@code ec2-default.xml}
 * and then {@code ec2-site.xml} from the classpath.
 */
public class Ec2Configuration extends Configuration {

  public static final String EC2_DEFAULT_RESOURCE = "ec2-default.xml";
  public static final String EC2_SITE_RESOURCE = "ec2-site.xml";

  static {
    activate();
  }

  public Ec2Configuration() {
    super();
  }

  public Ec2Configuration(Configuration conf) {
    super(conf);
  }

  /**
   * Wrap a plain Hadoop configuration, or return it unchanged when it
   * already is an Ec2Configuration.
   *
   * @param conf configuration to wrap
   * @return EC2 configuration
   */
  public static Ec2Configuration of(Configuration conf) {
    if (conf instanceof Ec2Configuration) {
      return (Ec2Configuration) conf;
    }
    return new Ec2Configuration(conf);
  }

  /**
   * Trim a string value, returning the default when it is unset or blank.
   *
   * @param name configuration key
   * @param defaultValue value used for unset or blank keys
   * @return trimmed value
   */
  public String getNonBlank(String name, String defaultValue) {
    String value = getTrimmed(name);
    if (value == null || value.isEmpty()) {
      return defaultValue;
    }
    return value;
  }

  public static void activate() {
    Configuration.addDefaultResource(EC2_DEFAULT_RESOURCE);
    Configuration.addDefaultResource(EC2_SITE_RESOURCE);
  }
}
