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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.annotations.VisibleForTesting;
import java.io.Closeable;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Authentication attached to individual calls, such as a bearer token. Owns exactly one {@link
 * CallCredentialsHandle} until {@link #close closed}.
 */
@ThreadSafe
public final class CallCredentials implements Closeable {
  private static final Logger logger = Logger.getLogger(CallCredentials.class.getName());

  private final CredentialsRuntime runtime;
  @GuardedBy("this")
  @Nullable
  private CallCredentialsHandle handle;

  private CallCredentials(CredentialsRuntime runtime) {
    this.runtime = checkNotNull(runtime, "runtime");
  }

  /**
   * Creates call credentials whose metadata is produced by {@code callback} for every call.
   *
   * @throws IllegalArgumentException if {@code callback} is null
   * @throws CredentialCreationException if the runtime could not build the credential
   */
  public static CallCredentials createFromPlugin(MetadataCallback callback) {
    checkArgument(callback != null, "Callback argument is not a valid callback");
    return createFromPlugin(CredentialsRuntimeRegistry.getDefaultRegistry().getRuntime(), callback);
  }

  @VisibleForTesting
  static CallCredentials createFromPlugin(CredentialsRuntime runtime, MetadataCallback callback) {
    checkArgument(callback != null, "Callback argument is not a valid callback");
    MetadataBridge plugin = new MetadataBridge(callback);
    CallCredentialsHandle pluginHandle = runtime.createPluginCallCredentials(plugin);
    if (pluginHandle == null) {
      plugin.destroy();
      throw new CredentialCreationException("Failed to create call credentials plugin");
    }
    CallCredentials credentials = new CallCredentials(runtime);
    credentials.init(pluginHandle);
    logger.log(Level.FINE, "Created plugin call credentials {0}", pluginHandle);
    return credentials;
  }

  /**
   * Creates call credentials that apply the metadata of both {@code first} and {@code second}. The
   * inputs stay owned by the caller and remain usable.
   *
   * @throws CredentialCreationException if the runtime rejected the combination
   */
  public static CallCredentials createComposite(CallCredentials first, CallCredentials second) {
    checkNotNull(first, "first");
    checkNotNull(second, "second");
    CallCredentialsHandle composite =
        first.runtime.createCompositeCallCredentials(first.handle(), second.handle());
    if (composite == null) {
      throw new CredentialCreationException("Failed to create call credentials composite");
    }
    CallCredentials credentials = new CallCredentials(first.runtime);
    credentials.init(composite);
    return credentials;
  }

  /**
   * Returns the owned handle. The reference stays owned by this object.
   *
   * @throws IllegalStateException if closed
   */
  public synchronized CallCredentialsHandle handle() {
    checkState(handle != null, "CallCredentials already closed");
    return handle;
  }

  /** Takes ownership of {@code newHandle}, releasing any handle held before. */
  @VisibleForTesting
  synchronized void init(CallCredentialsHandle newHandle) {
    checkNotNull(newHandle, "newHandle");
    destroy();
    handle = newHandle;
  }

  /** Releases the handle. Subsequent calls are no-ops. */
  @Override
  public synchronized void close() {
    destroy();
  }

  @GuardedBy("this")
  private void destroy() {
    if (handle != null) {
      handle.release();
      handle = null;
    }
  }
}
