/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.batchdriver.aws;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazonaws.auth.AWSCredentialsProvider;
import com.amazonaws.auth.AWSCredentialsProviderChain;
import com.amazonaws.auth.AWSStaticCredentialsProvider;
import com.amazonaws.auth.BasicAWSCredentials;
import com.amazonaws.auth.EC2ContainerCredentialsProviderWrapper;
import com.amazonaws.auth.EnvironmentVariableCredentialsProvider;
import com.amazonaws.auth.STSAssumeRoleSessionCredentialsProvider;
import com.amazonaws.auth.SystemPropertiesCredentialsProvider;
import com.amazonaws.auth.profile.ProfileCredentialsProvider;
import com.amazonaws.services.securitytoken.AWSSecurityTokenService;
import com.amazonaws.services.securitytoken.AWSSecurityTokenServiceClientBuilder;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.Lists;
import com.typesafe.config.Config;

import org.apache.batchdriver.util.ConfigUtils;


/**
 * Resolves the AWS credentials the driver's clients sign requests with.
 *
 * <p>
 *   Credentials come from the first source that has them: service keys in the driver configuration, environment
 *   variables, Java system properties, the default profile, then the container or instance profile. If
 *   {@link AWSBatchConfigurationKeys#CLIENT_ASSUME_ROLE_KEY} is set, those credentials are only used to assume the
 *   configured role through STS, and the resulting session credentials are refreshed by the SDK before they expire.
 * </p>
 */
public class AWSBatchSecurityManager {

  private static final Logger LOGGER = LoggerFactory.getLogger(AWSBatchSecurityManager.class);

  private final Config config;
  private final boolean clientAssumeRole;
  private final Supplier<AWSCredentialsProvider> credentialsProviderSupplier;

  public AWSBatchSecurityManager(final Config config) {
    this.config = config;
    this.clientAssumeRole = ConfigUtils.getBoolean(config, AWSBatchConfigurationKeys.CLIENT_ASSUME_ROLE_KEY, false);
    if (this.clientAssumeRole) {
      Preconditions.checkArgument(ConfigUtils.hasNonEmptyPath(config, AWSBatchConfigurationKeys.CLIENT_ROLE_ARN_KEY),
          "%s is required when %s is enabled", AWSBatchConfigurationKeys.CLIENT_ROLE_ARN_KEY,
          AWSBatchConfigurationKeys.CLIENT_ASSUME_ROLE_KEY);
    }

    this.credentialsProviderSupplier = Suppliers.memoize(new Supplier<AWSCredentialsProvider>() {
      @Override
      public AWSCredentialsProvider get() {
        AWSCredentialsProvider baseProvider = buildBaseCredentialsProvider();
        if (!clientAssumeRole) {
          return baseProvider;
        }
        return buildAssumeRoleCredentialsProvider(baseProvider);
      }
    });
  }

  public AWSCredentialsProvider getCredentialsProvider() {
    return this.credentialsProviderSupplier.get();
  }

  public boolean isAssumeRoleEnabled() {
    return this.clientAssumeRole;
  }

  @VisibleForTesting
  AWSCredentialsProvider buildBaseCredentialsProvider() {
    List<AWSCredentialsProvider> providers = Lists.newArrayList();
    if (ConfigUtils.hasNonEmptyPath(this.config, AWSBatchConfigurationKeys.SERVICE_ACCESS_KEY)
        && ConfigUtils.hasNonEmptyPath(this.config, AWSBatchConfigurationKeys.SERVICE_SECRET_KEY)) {
      LOGGER.info("Using AWS service credentials from the driver configuration");
      providers.add(new AWSStaticCredentialsProvider(
          new BasicAWSCredentials(this.config.getString(AWSBatchConfigurationKeys.SERVICE_ACCESS_KEY),
              this.config.getString(AWSBatchConfigurationKeys.SERVICE_SECRET_KEY))));
    }
    providers.add(new EnvironmentVariableCredentialsProvider());
    providers.add(new SystemPropertiesCredentialsProvider());
    providers.add(new ProfileCredentialsProvider());
    providers.add(new EC2ContainerCredentialsProviderWrapper());
    return new AWSCredentialsProviderChain(providers);
  }

  private AWSCredentialsProvider buildAssumeRoleCredentialsProvider(AWSCredentialsProvider baseProvider) {
    String roleArn = this.config.getString(AWSBatchConfigurationKeys.CLIENT_ROLE_ARN_KEY);
    String sessionId = ConfigUtils.getString(this.config, AWSBatchConfigurationKeys.CLIENT_SESSION_ID_KEY,
        AWSBatchConfigurationKeys.DEFAULT_CLIENT_SESSION_ID);
    LOGGER.info(String.format("Assuming role %s with session %s", roleArn, sessionId));

    AWSSecurityTokenService stsClient = AWSSecurityTokenServiceClientBuilder.standard()
        .withCredentials(baseProvider)
        .withRegion(ConfigUtils.getString(this.config, AWSBatchConfigurationKeys.AWS_REGION_KEY,
            AWSBatchConfigurationKeys.DEFAULT_AWS_REGION))
        .build();
    STSAssumeRoleSessionCredentialsProvider.Builder builder =
        new STSAssumeRoleSessionCredentialsProvider.Builder(roleArn, sessionId).withStsClient(stsClient);
    if (ConfigUtils.hasNonEmptyPath(this.config, AWSBatchConfigurationKeys.CLIENT_EXTERNAL_ID_KEY)) {
      builder.withExternalId(this.config.getString(AWSBatchConfigurationKeys.CLIENT_EXTERNAL_ID_KEY));
    }
    return builder.build();
  }
}
