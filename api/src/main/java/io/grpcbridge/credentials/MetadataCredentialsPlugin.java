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

/**
 * The synchronous plugin protocol through which a {@link CredentialsRuntime} obtains metadata for
 * a plugin-backed call credential. The runtime owns the plugin once it has built a handle for it
 * and calls {@link #destroy} exactly once, when that handle is deallocated.
 */
public interface MetadataCredentialsPlugin {
  /** Maximum number of entries a plugin may return synchronously from one call. */
  int MAX_SYNC_METADATA = 4;

  /**
   * Produces the metadata for one call into {@code result}. Protocol-level failures are reported
   * through {@link SyncMetadataResult#getStatusCode()} rather than thrown. Entries still held by a
   * reused {@code result} are released first.
   *
   * @return {@code true} when the result was produced synchronously
   * @throws MetadataCallbackException if the application callback failed
   * @throws InvalidCallbackResultException if the application callback returned a non-map
   */
  boolean getMetadata(AuthMetadataContext context, SyncMetadataResult result);

  /** Frees the plugin's state. */
  void destroy();

  /** A name for the kind of plugin, used in logs. */
  String getType();
}
