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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import io.grpc.InsecureChannelCredentials;
import io.grpcbridge.credentials.CallCredentials;
import io.grpcbridge.credentials.CallCredentialsHandle;
import io.grpcbridge.credentials.ChannelCredentials;
import io.grpcbridge.credentials.ChannelCredentialsHandle;
import javax.annotation.Nullable;

/**
 * Converts bridge credentials into the grpc-java credentials they were built from, for use with
 * {@code Grpc.newChannelBuilder()} and {@code CallOptions.withCallCredentials()}.
 *
 * <p>The returned objects stay valid only while the bridge credential they came from is open.
 */
public final class GrpcCredentials {
  private GrpcCredentials() {}

  /**
   * Returns the grpc-java channel credentials of {@code credentials}. {@code null}, as returned by
   * {@link ChannelCredentials#createInsecure()}, maps to {@link InsecureChannelCredentials}.
   *
   * @throws IllegalArgumentException if the credentials were not built by {@link
   *     GrpcCredentialsRuntime}
   */
  public static io.grpc.ChannelCredentials toGrpcChannelCredentials(
      @Nullable ChannelCredentials credentials) {
    if (credentials == null) {
      return InsecureChannelCredentials.create();
    }
    ChannelCredentialsHandle handle = credentials.handle();
    checkArgument(handle instanceof GrpcChannelCredentialsHandle,
        "Not built by GrpcCredentialsRuntime: %s", handle);
    return ((GrpcChannelCredentialsHandle) handle).getGrpcCredentials();
  }

  /**
   * Returns the grpc-java call credentials of {@code credentials}.
   *
   * @throws IllegalArgumentException if the credentials were not built by {@link
   *     GrpcCredentialsRuntime}
   */
  public static io.grpc.CallCredentials toGrpcCallCredentials(CallCredentials credentials) {
    checkNotNull(credentials, "credentials");
    CallCredentialsHandle handle = credentials.handle();
    checkArgument(handle instanceof GrpcCallCredentialsHandle,
        "Not built by GrpcCredentialsRuntime: %s", handle);
    return ((GrpcCallCredentialsHandle) handle).getGrpcCredentials();
  }
}
