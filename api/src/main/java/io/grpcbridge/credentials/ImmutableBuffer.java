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
import static com.google.common.base.Preconditions.checkPositionIndexes;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.concurrent.ThreadSafe;

/**
 * A reference-counted, immutable sequence of bytes. Used for certificate bundles and for the
 * keys and values of authentication metadata.
 *
 * <p>A freshly created buffer has a reference count of one. Every {@link #retain} must be paired
 * with a {@link #release}; the backing storage is dropped when the count reaches zero and any
 * further access fails with {@link IllegalStateException}. Buffers created with {@link
 * #fromSharedSlice} share both the storage and the reference count of their source.
 *
 * <p>Equality is defined by content only.
 */
@ThreadSafe
public final class ImmutableBuffer {
  private static final byte[] EMPTY_BYTES = new byte[0];

  private final Storage storage;
  private final int offset;
  private final int length;

  private ImmutableBuffer(Storage storage, int offset, int length) {
    this.storage = storage;
    this.offset = offset;
    this.length = length;
  }

  /** Creates a buffer holding a private copy of {@code bytes}. */
  public static ImmutableBuffer fromBytes(byte[] bytes) {
    checkNotNull(bytes, "bytes");
    byte[] copy = Arrays.copyOf(bytes, bytes.length);
    return new ImmutableBuffer(new Storage(copy), 0, copy.length);
  }

  /** Creates a buffer holding the UTF-8 encoding of {@code value}. */
  public static ImmutableBuffer copyFromUtf8(String value) {
    checkNotNull(value, "value");
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    return new ImmutableBuffer(new Storage(bytes), 0, bytes.length);
  }

  /** Creates a new, empty buffer. */
  public static ImmutableBuffer empty() {
    return new ImmutableBuffer(new Storage(EMPTY_BYTES), 0, 0);
  }

  /**
   * Returns a buffer sharing the storage of {@code existing} without copying. The shared storage
   * is retained once; releasing either buffer releases that shared reference.
   */
  public static ImmutableBuffer fromSharedSlice(ImmutableBuffer existing) {
    return fromSharedSlice(existing, 0, existing.length);
  }

  /**
   * Returns a buffer viewing {@code length} bytes of {@code existing} starting at {@code offset},
   * sharing its storage. The shared storage is retained once.
   */
  public static ImmutableBuffer fromSharedSlice(ImmutableBuffer existing, int offset, int length) {
    checkNotNull(existing, "existing");
    checkPositionIndexes(offset, offset + length, existing.length);
    existing.storage.retain();
    return new ImmutableBuffer(existing.storage, existing.offset + offset, length);
  }

  /** Number of bytes in this buffer. */
  public int size() {
    return length;
  }

  public boolean isEmpty() {
    return length == 0;
  }

  /** Returns a read-only view over the content. The view is only valid while retained. */
  public ByteBuffer asReadOnlyByteBuffer() {
    return ByteBuffer.wrap(storage.bytes(), offset, length).slice().asReadOnlyBuffer();
  }

  /** Returns a copy of the content that the caller owns. */
  public byte[] toByteArray() {
    return Arrays.copyOfRange(storage.bytes(), offset, offset + length);
  }

  public String toStringUtf8() {
    return new String(storage.bytes(), offset, length, StandardCharsets.UTF_8);
  }

  /** Returns {@code true} if the content equals {@code other} byte for byte. */
  public boolean contentEquals(byte[] other) {
    checkNotNull(other, "other");
    byte[] bytes = storage.bytes();
    if (other.length != length) {
      return false;
    }
    for (int i = 0; i < length; i++) {
      if (bytes[offset + i] != other[i]) {
        return false;
      }
    }
    return true;
  }

  /** Increments the reference count. */
  @CanIgnoreReturnValue
  public ImmutableBuffer retain() {
    storage.retain();
    return this;
  }

  /**
   * Decrements the reference count, dropping the storage when it reaches zero.
   *
   * @return {@code true} if this call dropped the storage
   * @throws IllegalStateException if the buffer has already been fully released
   */
  @CanIgnoreReturnValue
  public boolean release() {
    return storage.release();
  }

  /** Current reference count of the (possibly shared) storage. */
  public int refCnt() {
    return storage.refCnt.get();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ImmutableBuffer)) {
      return false;
    }
    ImmutableBuffer that = (ImmutableBuffer) o;
    if (length != that.length) {
      return false;
    }
    byte[] mine = storage.bytes();
    byte[] theirs = that.storage.bytes();
    for (int i = 0; i < length; i++) {
      if (mine[offset + i] != theirs[that.offset + i]) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    byte[] bytes = storage.bytes();
    int result = 1;
    for (int i = offset; i < offset + length; i++) {
      result = 31 * result + bytes[i];
    }
    return result;
  }

  @Override
  public String toString() {
    return "ImmutableBuffer{size=" + length + ", refCnt=" + refCnt() + "}";
  }

  private static final class Storage {
    private final AtomicInteger refCnt = new AtomicInteger(1);
    private volatile byte[] bytes;

    Storage(byte[] bytes) {
      this.bytes = bytes;
    }

    byte[] bytes() {
      byte[] current = bytes;
      if (current == null) {
        throw new IllegalStateException("Buffer accessed after its last reference was released");
      }
      return current;
    }

    void retain() {
      while (true) {
        int count = refCnt.get();
        if (count <= 0) {
          throw new IllegalStateException("Cannot retain a released buffer");
        }
        if (refCnt.compareAndSet(count, count + 1)) {
          return;
        }
      }
    }

    boolean release() {
      while (true) {
        int count = refCnt.get();
        if (count <= 0) {
          throw new IllegalStateException("Buffer released more times than retained");
        }
        if (refCnt.compareAndSet(count, count - 1)) {
          if (count == 1) {
            bytes = null;
            return true;
          }
          return false;
        }
      }
    }
  }
}
