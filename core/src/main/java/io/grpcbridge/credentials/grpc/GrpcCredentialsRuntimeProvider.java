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

package io.grpcbridge.credentials.grpc;

import io.grpcbridge.credentials.CredentialsRuntime;
import io.grpcbridge.credentials.CredentialsRuntimeProvider;

/** Provider for {@link GrpcCredentialsRuntime}. */
public final class GrpcCredentialsRuntimeProvider extends CredentialsRuntimeProvider {
  @Override
  protected boolean isAvailable() {
    return true;
  }

  @Override
  protected int priority() {
    return 5;
  }

  @Override
  protected CredentialsRuntime newRuntime() {
    return new GrpcCredentialsRuntime();
  }
}
