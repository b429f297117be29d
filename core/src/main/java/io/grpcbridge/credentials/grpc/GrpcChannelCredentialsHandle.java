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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import io.grpc.ChannelCredentials;
import io.grpcbridge.credentials.ChannelCredentialsHandle;
import io.grpcbridge.credentials.CredentialsHandle;

/** A channel credential handle wrapping grpc-java {@link ChannelCredentials}. */
public final class GrpcChannelCredentialsHandle extends ChannelCredentialsHandle {
  private final ChannelCredentials grpcCredentials;
  private final ImmutableList<CredentialsHandle> dependencies;

  GrpcChannelCredentialsHandle(
      ChannelCredentials grpcCredentials, ImmutableList<CredentialsHandle> dependencies) {
    this.grpcCredentials = checkNotNull(grpcCredentials, "grpcCredentials");
    this.dependencies = checkNotNull(dependencies, "dependencies");
  }

  public ChannelCredentials getGrpcCredentials() {
    return grpcCredentials;
  }

  @Override
  protected void deallocate() {
    for (CredentialsHandle dependency : dependencies) {
      dependency.release();
    }
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("grpcCredentials", grpcCredentials)
        .add("refCnt", refCnt())
        .toString();
  }
}
