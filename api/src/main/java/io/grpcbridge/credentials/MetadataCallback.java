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

import javax.annotation.Nullable;

/**
 * Application code producing authentication metadata for each outgoing call. Used with {@link
 * CallCredentials#createFromPlugin}.
 *
 * <p>The callback runs synchronously on the thread preparing the call, which stays blocked until
 * it returns; there is no timeout. Calls sharing a credential may invoke it concurrently, so
 * implementations must be thread-safe.
 */
public interface MetadataCallback {
  /**
   * Returns the metadata to attach to the call described by {@code context}.
   *
   * <p>The result must be a {@link java.util.Map} from lowercase header name to value. A value may
   * be a {@link CharSequence}, a {@code byte[]}, an {@link ImmutableBuffer}, or an {@link
   * Iterable} or array of those for a repeated header. Keys ending in {@code -bin} carry binary
   * values; other values must be printable ASCII.
   *
   * <p>Throwing fails the call.
   */
  @Nullable
  Object getMetadata(AuthMetadataContext context) throws Exception;
}
