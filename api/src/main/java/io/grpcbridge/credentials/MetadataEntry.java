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

import com.google.common.base.MoreObjects;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * One authentication metadata item. The entry holds a reference on both its key and its value;
 * {@link #retain} and {@link #release} act on both.
 */
public final class MetadataEntry {
  /** Suffix marking keys whose values are arbitrary bytes instead of printable ASCII. */
  public static final String BINARY_KEY_SUFFIX = "-bin";

  private final ImmutableBuffer key;
  private final ImmutableBuffer value;

  /** Creates an entry taking over one reference on each of {@code key} and {@code value}. */
  public MetadataEntry(ImmutableBuffer key, ImmutableBuffer value) {
    this.key = checkNotNull(key, "key");
    this.value = checkNotNull(value, "value");
  }

  public static MetadataEntry of(String key, String value) {
    return new MetadataEntry(ImmutableBuffer.copyFromUtf8(key), ImmutableBuffer.copyFromUtf8(value));
  }

  public ImmutableBuffer getKey() {
    return key;
  }

  public ImmutableBuffer getValue() {
    return value;
  }

  /** Whether the key ends with {@value #BINARY_KEY_SUFFIX}. */
  public boolean isBinary() {
    return key.toStringUtf8().endsWith(BINARY_KEY_SUFFIX);
  }

  @CanIgnoreReturnValue
  public MetadataEntry retain() {
    key.retain();
    value.retain();
    return this;
  }

  public void release() {
    key.release();
    value.release();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof MetadataEntry)) {
      return false;
    }
    MetadataEntry that = (MetadataEntry) o;
    return key.equals(that.key) && value.equals(that.value);
  }

  @Override
  public int hashCode() {
    return 31 * key.hashCode() + value.hashCode();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("key", key.toStringUtf8())
        .add("valueSize", value.size())
        .toString();
  }
}
