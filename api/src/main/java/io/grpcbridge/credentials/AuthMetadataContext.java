/*
 * Copyright 2026 The gRPC Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.grpcbridge.credentials;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

/** Describes the call for which authentication metadata is being requested. */
public final class AuthMetadataContext {
  private final String serviceUrl;
  private final String methodName;

  public AuthMetadataContext(String serviceUrl, String methodName) {
    this.serviceUrl = checkNotNull(serviceUrl, "serviceUrl");
    this.methodName = checkNotNull(methodName, "methodName");
  }

  /** The URL of the service being called, e.g. {@code https://example.com/package.Service}. */
  public String getServiceUrl() {
    return serviceUrl;
  }

  /** The bare name of the method being called, e.g. {@code Get}. */
  public String getMethodName() {
    return methodName;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof AuthMetadataContext)) {
      return false;
    }
    AuthMetadataContext that = (AuthMetadataContext) o;
    return serviceUrl.equals(that.serviceUrl) && methodName.equals(that.methodName);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(serviceUrl, methodName);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("serviceUrl", serviceUrl)
        .add("methodName", methodName)
        .toString();
  }
}
