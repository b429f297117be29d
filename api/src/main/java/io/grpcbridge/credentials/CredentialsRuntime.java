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
 * The layer that actually builds credential objects for a transport. Every factory returns a new
 * handle with a reference count of one, owned by the caller, or {@code null} if the credential
 * could not be built. Composite handles take their own references on their inputs.
 *
 * <p>Runtimes are discovered through {@link CredentialsRuntimeRegistry}.
 */
public abstract class CredentialsRuntime {
  /**
   * Builds a call credential whose metadata comes from {@code plugin}. On success the runtime owns
   * the plugin and calls {@link MetadataCredentialsPlugin#destroy} when the handle is
   * deallocated. On failure ownership stays with the caller.
   */
  @Nullable
  public abstract CallCredentialsHandle createPluginCallCredentials(
      MetadataCredentialsPlugin plugin);

  /** Builds a call credential applying the metadata of both inputs. */
  @Nullable
  public abstract CallCredentialsHandle createCompositeCallCredentials(
      CallCredentialsHandle first, CallCredentialsHandle second);

  /** Builds the platform's default channel credential. */
  @Nullable
  public abstract ChannelCredentialsHandle createDefaultChannelCredentials();

  /**
   * Builds a TLS channel credential. Absent {@code pemRootCerts} means default roots; a client
   * identity is used when {@code pemPrivateKey} and {@code pemCertChain} are both present.
   */
  @Nullable
  public abstract ChannelCredentialsHandle createSslChannelCredentials(
      @Nullable byte[] pemRootCerts, @Nullable byte[] pemPrivateKey,
      @Nullable byte[] pemCertChain);

  /** Builds a channel credential that also applies {@code callCredentials} to every call. */
  @Nullable
  public abstract ChannelCredentialsHandle createCompositeChannelCredentials(
      ChannelCredentialsHandle channelCredentials, CallCredentialsHandle callCredentials);

  /** Installs the source of default roots consulted when a TLS credential has none. */
  public abstract void setSslRootsOverrideCallback(SslRootsOverrideCallback callback);
}
