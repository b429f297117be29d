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
import io.grpc.CallCredentials;
import io.grpcbridge.credentials.CallCredentialsHandle;
import io.grpcbridge.credentials.CredentialsHandle;
import io.grpcbridge.credentials.MetadataCredentialsPlugin;
import javax.annotation.Nullable;

/** A call credential handle wrapping grpc-java {@link CallCredentials}. */
public final class GrpcCallCredentialsHandle extends CallCredentialsHandle {
  private final CallCredentials grpcCredentials;
  @Nullable
  private final MetadataCredentialsPlugin plugin;
  private final ImmutableList<CredentialsHandle> dependencies;

  GrpcCallCredentialsHandle(CallCredentials grpcCredentials,
      @Nullable MetadataCredentialsPlugin plugin, ImmutableList<CredentialsHandle> dependencies) {
    this.grpcCredentials = checkNotNull(grpcCredentials, "grpcCredentials");
    this.plugin = plugin;
    this.dependencies = checkNotNull(dependencies, "dependencies");
  }

  public CallCredentials getGrpcCredentials() {
    return grpcCredentials;
  }

  @Override
  protected void deallocate() {
    if (plugin != null) {
      plugin.destroy();
    }
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
