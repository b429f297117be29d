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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import java.io.Closeable;
import java.nio.charset.StandardCharsets;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Transport security for a channel, such as TLS, optionally combined with {@link CallCredentials}
 * applied to every call on the channel. Owns exactly one {@link ChannelCredentialsHandle} until
 * {@link #close closed}.
 *
 * <p>Each credential carries a {@linkplain #getHashKey hash key} identifying the client key
 * material it was built from. Two credentials with equal non-empty hash keys were built from the
 * same private key and certificate chain, so callers caching channels may treat them as
 * interchangeable.
 */
@ThreadSafe
public final class ChannelCredentials implements Closeable {
  private final CredentialsRuntime runtime;
  private final String hashKey;
  @GuardedBy("this")
  @Nullable
  private ChannelCredentialsHandle handle;

  private ChannelCredentials(CredentialsRuntime runtime, ChannelCredentialsHandle handle,
      String hashKey) {
    this.runtime = checkNotNull(runtime, "runtime");
    this.handle = checkNotNull(handle, "handle");
    this.hashKey = checkNotNull(hashKey, "hashKey");
  }

  /**
   * Sets the PEM root certificates used by TLS credentials that do not specify their own. Takes
   * effect for every credential built afterwards in this process.
   */
  public static void setDefaultRootsPem(byte[] pemRootCerts) {
    DefaultRootCertStore.getInstance().set(pemRootCerts);
  }

  /** Same as {@link #setDefaultRootsPem(byte[])} for a PEM string. */
  public static void setDefaultRootsPem(String pemRootCerts) {
    checkNotNull(pemRootCerts, "pemRootCerts");
    setDefaultRootsPem(pemRootCerts.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Creates the platform's default channel credentials.
   *
   * @throws CredentialCreationException if they are unavailable
   */
  public static ChannelCredentials createDefault() {
    return createDefault(CredentialsRuntimeRegistry.getDefaultRegistry().getRuntime());
  }

  @VisibleForTesting
  static ChannelCredentials createDefault(CredentialsRuntime runtime) {
    ChannelCredentialsHandle created = runtime.createDefaultChannelCredentials();
    if (created == null) {
      throw new CredentialCreationException("Failed to create default channel credentials");
    }
    return new ChannelCredentials(runtime, created, "");
  }

  /**
   * Creates TLS channel credentials.
   *
   * @param pemRootCerts trusted roots, or {@code null} for the defaults
   * @param pemPrivateKey the client's private key, or {@code null}
   * @param pemCertChain the client's certificate chain, or {@code null}
   * @throws CredentialCreationException if the credentials could not be built
   */
  public static ChannelCredentials createSsl(@Nullable byte[] pemRootCerts,
      @Nullable byte[] pemPrivateKey, @Nullable byte[] pemCertChain) {
    return createSsl(CredentialsRuntimeRegistry.getDefaultRegistry().getRuntime(),
        pemRootCerts, pemPrivateKey, pemCertChain);
  }

  @VisibleForTesting
  static ChannelCredentials createSsl(CredentialsRuntime runtime, @Nullable byte[] pemRootCerts,
      @Nullable byte[] pemPrivateKey, @Nullable byte[] pemCertChain) {
    String hashKey = computeHashKey(pemPrivateKey, pemCertChain);
    ChannelCredentialsHandle created =
        runtime.createSslChannelCredentials(pemRootCerts, pemPrivateKey, pemCertChain);
    if (created == null) {
      throw new CredentialCreationException("Failed to create SSL channel credentials");
    }
    return new ChannelCredentials(runtime, created, hashKey);
  }

  /**
   * Creates channel credentials applying {@code callCredentials} on top of {@code
   * channelCredentials}. The result has the hash key of {@code channelCredentials}. The inputs
   * stay owned by the caller.
   *
   * @throws CredentialCreationException if the runtime rejected the combination
   */
  public static ChannelCredentials createComposite(
      ChannelCredentials channelCredentials, CallCredentials callCredentials) {
    checkNotNull(channelCredentials, "channelCredentials");
    checkNotNull(callCredentials, "callCredentials");
    ChannelCredentialsHandle created = channelCredentials.runtime.createCompositeChannelCredentials(
        channelCredentials.handle(), callCredentials.handle());
    if (created == null) {
      throw new CredentialCreationException("Failed to create composite channel credentials");
    }
    return new ChannelCredentials(channelCredentials.runtime, created, channelCredentials.hashKey);
  }

  /**
   * Returns {@code null}: insecure channels have no credentials object. Callers must treat {@code
   * null} as "no transport security" rather than as a failure.
   */
  @Nullable
  public static ChannelCredentials createInsecure() {
    return null;
  }

  /**
   * Hex SHA-1 digest of the private key followed by the certificate chain, or the empty string if
   * the credential was not built from both.
   */
  public String getHashKey() {
    return hashKey;
  }

  /**
   * Returns the owned handle. The reference stays owned by this object.
   *
   * @throws IllegalStateException if closed
   */
  public synchronized ChannelCredentialsHandle handle() {
    checkState(handle != null, "ChannelCredentials already closed");
    return handle;
  }

  /** Takes ownership of {@code newHandle}, releasing any handle held before. */
  @VisibleForTesting
  synchronized void init(ChannelCredentialsHandle newHandle) {
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

  @SuppressWarnings("deprecation")
  @VisibleForTesting
  static String computeHashKey(@Nullable byte[] pemPrivateKey, @Nullable byte[] pemCertChain) {
    if (pemPrivateKey == null || pemCertChain == null) {
      return "";
    }
    Hasher hasher = Hashing.sha1().newHasher();
    hasher.putBytes(pemPrivateKey);
    hasher.putBytes(pemCertChain);
    return hasher.hash().toString();
  }
}
