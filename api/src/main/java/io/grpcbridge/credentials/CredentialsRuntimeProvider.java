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
 * Provider of a {@link CredentialsRuntime}, loaded through the Java service loader by {@link
 * CredentialsRuntimeRegistry}. Implementations must have a public no-argument constructor.
 */
public abstract class CredentialsRuntimeProvider {
  /**
   * Whether this provider can be used in the current environment. Unavailable providers are
   * ignored by the registry.
   */
  protected abstract boolean isAvailable();

  /**
   * A priority from 0 to 10, higher preferred. 5 should be used for a provider that works in most
   * environments.
   */
  protected abstract int priority();

  /** Creates the runtime. Called at most once per registry. */
  protected abstract CredentialsRuntime newRuntime();
}
