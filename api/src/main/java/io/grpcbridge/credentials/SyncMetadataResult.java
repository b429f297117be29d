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

import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import io.grpc.Status;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * Output of one synchronous {@link MetadataCredentialsPlugin#getMetadata} call: a fixed array of
 * {@link MetadataCredentialsPlugin#MAX_SYNC_METADATA} entry slots, the number of slots filled, a
 * status code and optional error details.
 *
 * <p>Each returned entry carries its own reference. The runtime calls {@link #releaseEntries}
 * after it has copied the entries out.
 */
@NotThreadSafe
public final class SyncMetadataResult {
  private final MetadataEntry[] entries =
      new MetadataEntry[MetadataCredentialsPlugin.MAX_SYNC_METADATA];
  private int numEntries;
  private Status.Code statusCode = Status.Code.OK;
  @Nullable
  private String errorDetails;

  /** Number of entry slots. */
  public int capacity() {
    return entries.length;
  }

  public int getNumEntries() {
    return numEntries;
  }

  public MetadataEntry getEntry(int index) {
    checkElementIndex(index, numEntries);
    return entries[index];
  }

  /** The filled entries, in order. */
  public ImmutableList<MetadataEntry> getEntries() {
    ImmutableList.Builder<MetadataEntry> builder = ImmutableList.builder();
    for (int i = 0; i < numEntries; i++) {
      builder.add(entries[i]);
    }
    return builder.build();
  }

  public Status.Code getStatusCode() {
    return statusCode;
  }

  @Nullable
  public String getErrorDetails() {
    return errorDetails;
  }

  /** Releases and clears every returned entry. */
  public void releaseEntries() {
    for (int i = 0; i < numEntries; i++) {
      entries[i].release();
      entries[i] = null;
    }
    numEntries = 0;
  }

  void setEntry(int index, MetadataEntry entry) {
    checkElementIndex(index, entries.length);
    entries[index] = checkNotNull(entry, "entry");
  }

  void setNumEntries(int numEntries) {
    this.numEntries = numEntries;
  }

  void setStatus(Status.Code statusCode, @Nullable String errorDetails) {
    this.statusCode = checkNotNull(statusCode, "statusCode");
    this.errorDetails = errorDetails;
  }
}
