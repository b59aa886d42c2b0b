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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Preconditions;

import lombok.EqualsAndHashCode;
import lombok.Getter;


/**
 * A bucket and key pair addressing one S3 object, rendered as {@code s3://bucket/key}.
 */
@Getter
@EqualsAndHashCode
public class S3Location {

  public static final String S3_SCHEME = "s3://";

  private static final Pattern S3_URI_PATTERN = Pattern.compile("s3://(.+?)/(.+)");

  private final String bucket;
  private final String key;

  public S3Location(String bucket, String key) {
    Preconditions.checkArgument(bucket != null && !bucket.isEmpty(), "bucket cannot be empty");
    Preconditions.checkArgument(key != null && !key.isEmpty(), "key cannot be empty");
    this.bucket = bucket;
    this.key = key;
  }

  /**
   * Parse an {@code s3://bucket/key} URI.
   *
   * @throws IllegalArgumentException if the scheme is missing or the URI has no key part
   */
  public static S3Location parse(String uri) {
    Preconditions.checkNotNull(uri, "S3 URI cannot be null");
    Matcher matcher = S3_URI_PATTERN.matcher(uri);
    Preconditions.checkArgument(matcher.matches(), "Invalid S3 URI, expected s3://bucket/key: %s", uri);
    return new S3Location(matcher.group(1), matcher.group(2));
  }

  /**
   * @return the location of {@code name} under this location's key
   */
  public S3Location resolve(String name) {
    return new S3Location(this.bucket, this.key + "/" + name);
  }

  @Override
  public String toString() {
    return S3_SCHEME + this.bucket + "/" + this.key;
  }
}
