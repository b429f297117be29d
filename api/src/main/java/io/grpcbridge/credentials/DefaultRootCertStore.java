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

import com.google.common.annotations.VisibleForTesting;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Process-wide default PEM root certificates, consulted by the {@link CredentialsRuntime} when a
 * TLS credential carries no roots of its own. Reads proceed concurrently; writes are serialized
 * and exclude readers.
 */
@ThreadSafe
final class DefaultRootCertStore implements SslRootsOverrideCallback {
  private static final Logger logger = Logger.getLogger(DefaultRootCertStore.class.getName());

  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private final AtomicLong exclusiveWriteCount = new AtomicLong();
  @GuardedBy("lock")
  @Nullable
  private ImmutableBuffer roots;

  @VisibleForTesting
  DefaultRootCertStore() {}

  static DefaultRootCertStore getInstance() {
    return InstanceHolder.INSTANCE;
  }

  /**
   * Returns the current roots with a reference retained for the caller, who must release it, or
   * {@code null} if the roots were never set.
   */
  @Nullable
  ImmutableBuffer get() {
    lock.readLock().lock();
    try {
      return roots == null ? null : roots.retain();
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Replaces the roots with a copy of {@code pemRootCerts}. */
  void set(byte[] pemRootCerts) {
    checkNotNull(pemRootCerts, "pemRootCerts");
    lock.readLock().lock();
    try {
      if (roots != null && roots.contentEquals(pemRootCerts)) {
        return;
      }
    } finally {
      lock.readLock().unlock();
    }

    lock.writeLock().lock();
    try {
      exclusiveWriteCount.incrementAndGet();
      // Another writer may have won the race.
      if (roots != null && roots.contentEquals(pemRootCerts)) {
        return;
      }
      ImmutableBuffer previous = roots;
      roots = ImmutableBuffer.fromBytes(pemRootCerts);
      if (previous != null) {
        previous.release();
      }
    } finally {
      lock.writeLock().unlock();
    }
    logger.log(Level.FINE, "Default root certificates replaced ({0} bytes)", pemRootCerts.length);
  }

  @Override
  public SslRootsOverride getRootsOverride() {
    ImmutableBuffer current = get();
    if (current == null) {
      return SslRootsOverride.fail();
    }
    try {
      return SslRootsOverride.ok(current.toByteArray());
    } finally {
      current.release();
    }
  }

  /** Number of times {@link #set} took the exclusive lock. */
  @VisibleForTesting
  long exclusiveWriteCount() {
    return exclusiveWriteCount.get();
  }

  private static final class InstanceHolder {
    static final DefaultRootCertStore INSTANCE = new DefaultRootCertStore();
  }
}
