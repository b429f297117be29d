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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.concurrent.ThreadSafe;

/**
 * An opaque credential object owned by a {@link CredentialsRuntime}. Handles are reference
 * counted: creation returns a handle with a count of one, and {@link #deallocate} runs exactly
 * once, on the release that brings the count to zero.
 *
 * <p>Runtimes extend {@link CallCredentialsHandle} or {@link ChannelCredentialsHandle}.
 */
@ThreadSafe
public abstract class CredentialsHandle {
  private final AtomicInteger refCnt = new AtomicInteger(1);

  /**
   * Adds a reference.
   *
   * @throws IllegalStateException if the handle was already deallocated
   */
  @CanIgnoreReturnValue
  public final CredentialsHandle retain() {
    while (true) {
      int count = refCnt.get();
      if (count <= 0) {
        throw new IllegalStateException("Cannot retain a deallocated " + this);
      }
      if (refCnt.compareAndSet(count, count + 1)) {
        return this;
      }
    }
  }

  /**
   * Drops a reference, deallocating the handle when none remain.
   *
   * @return {@code true} if the handle was deallocated by this call
   * @throws IllegalStateException if the handle was already deallocated
   */
  @CanIgnoreReturnValue
  public final boolean release() {
    while (true) {
      int count = refCnt.get();
      if (count <= 0) {
        throw new IllegalStateException(this + " released more times than retained");
      }
      if (refCnt.compareAndSet(count, count - 1)) {
        if (count == 1) {
          deallocate();
          return true;
        }
        return false;
      }
    }
  }

  public final int refCnt() {
    return refCnt.get();
  }

  /** Frees the resources of this handle. Called exactly once. */
  protected abstract void deallocate();
}
