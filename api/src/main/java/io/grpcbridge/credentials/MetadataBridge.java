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
import io.grpc.Status;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Bridges the synchronous {@link MetadataCredentialsPlugin} protocol to an application {@link
 * MetadataCallback}. Each {@link #getMetadata} call is an independent transaction: it invokes the
 * callback, validates what came back and copies it into the fixed-size result.
 */
@ThreadSafe
final class MetadataBridge implements MetadataCredentialsPlugin {
  private static final Logger logger = Logger.getLogger(MetadataBridge.class.getName());

  static final String PLUGIN_TYPE = "metadata_callback";
  @VisibleForTesting
  static final String TOO_MANY_ENTRIES_DETAILS =
      "Plugin credentials returned too many metadata entries";

  private final AtomicReference<PluginState> state;

  MetadataBridge(MetadataCallback callback) {
    this.state = new AtomicReference<>(new PluginState(callback));
  }

  @Override
  public boolean getMetadata(AuthMetadataContext context, SyncMetadataResult result) {
    checkNotNull(context, "context");
    checkNotNull(result, "result");
    PluginState current = state.get();
    checkState(current != null, "Metadata plugin used after destroy");

    AuthMetadataContext callbackContext =
        new AuthMetadataContext(context.getServiceUrl(), context.getMethodName());
    Object returned;
    try {
      returned = current.callback.getMetadata(callbackContext);
    } catch (Exception e) {
      if (e instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      throw new MetadataCallbackException(
          "Metadata callback failed for " + callbackContext.getServiceUrl(), e);
    }
    if (!(returned instanceof Map)) {
      throw new InvalidCallbackResultException(
          "Callback return value expected a Map, got "
              + (returned == null ? "null" : returned.getClass().getName()));
    }

    result.releaseEntries();
    result.setStatus(Status.Code.OK, null);

    List<MetadataEntry> entries;
    try {
      entries = toEntries((Map<?, ?>) returned);
    } catch (InvalidMetadataException e) {
      logger.log(Level.WARNING, "Rejected metadata from callback: {0}", e.getMessage());
      result.setStatus(Status.Code.INVALID_ARGUMENT, null);
      return true;
    }

    try {
      if (entries.size() > MAX_SYNC_METADATA) {
        logger.log(Level.WARNING, "Callback returned {0} metadata entries, at most {1} allowed",
            new Object[] {entries.size(), MAX_SYNC_METADATA});
        result.setStatus(Status.Code.INTERNAL, TOO_MANY_ENTRIES_DETAILS);
      } else {
        for (int i = 0; i < entries.size(); i++) {
          // The output outlives the local list released below.
          result.setEntry(i, entries.get(i).retain());
        }
        result.setNumEntries(entries.size());
      }
    } finally {
      releaseAll(entries);
    }
    return true;
  }

  @Override
  public void destroy() {
    PluginState old = state.getAndSet(null);
    checkState(old != null, "Metadata plugin already destroyed");
    logger.log(Level.FINE, "Destroyed metadata plugin state for {0}", old.callback);
  }

  @Override
  public String getType() {
    return PLUGIN_TYPE;
  }

  @VisibleForTesting
  boolean isDestroyed() {
    return state.get() == null;
  }

  private static List<MetadataEntry> toEntries(Map<?, ?> metadata)
      throws InvalidMetadataException {
    List<MetadataEntry> entries = new ArrayList<>(metadata.size());
    boolean success = false;
    try {
      for (Map.Entry<?, ?> mapEntry : metadata.entrySet()) {
        String key = validateKey(mapEntry.getKey());
        Object value = mapEntry.getValue();
        if (value instanceof Iterable) {
          for (Object element : (Iterable<?>) value) {
            addEntry(entries, key, element);
          }
        } else if (value instanceof Object[]) {
          for (Object element : (Object[]) value) {
            addEntry(entries, key, element);
          }
        } else {
          addEntry(entries, key, value);
        }
      }
      success = true;
      return entries;
    } finally {
      if (!success) {
        releaseAll(entries);
      }
    }
  }

  private static void addEntry(List<MetadataEntry> entries, String key, Object value)
      throws InvalidMetadataException {
    ImmutableBuffer valueBuffer = toValueBuffer(key, value);
    entries.add(new MetadataEntry(ImmutableBuffer.copyFromUtf8(key), valueBuffer));
  }

  private static String validateKey(Object key) throws InvalidMetadataException {
    if (!(key instanceof CharSequence)) {
      throw new InvalidMetadataException("Metadata key must be a string, got " + key);
    }
    String name = key.toString();
    if (name.isEmpty()) {
      throw new InvalidMetadataException("Metadata key must not be empty");
    }
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (!((c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '-' || c == '_'
          || c == '.')) {
        throw new InvalidMetadataException("Metadata key is not legal: " + name);
      }
    }
    return name;
  }

  private static ImmutableBuffer toValueBuffer(String key, Object value)
      throws InvalidMetadataException {
    ImmutableBuffer buffer;
    if (value instanceof CharSequence) {
      buffer = ImmutableBuffer.copyFromUtf8(value.toString());
    } else if (value instanceof byte[]) {
      buffer = ImmutableBuffer.fromBytes((byte[]) value);
    } else if (value instanceof ImmutableBuffer) {
      try {
        buffer = ImmutableBuffer.fromSharedSlice((ImmutableBuffer) value);
      } catch (IllegalStateException e) {
        throw new InvalidMetadataException(
            "Value for metadata key " + key + " is a released buffer", e);
      }
    } else {
      throw new InvalidMetadataException("Value for metadata key " + key + " must be a string, "
          + "byte[] or ImmutableBuffer, got " + (value == null ? "null" : value.getClass()));
    }
    if (!key.endsWith(MetadataEntry.BINARY_KEY_SUFFIX) && !isPrintableAscii(buffer)) {
      buffer.release();
      throw new InvalidMetadataException("Value for metadata key " + key + " is not legal");
    }
    return buffer;
  }

  private static boolean isPrintableAscii(ImmutableBuffer buffer) {
    byte[] bytes = buffer.toByteArray();
    for (byte b : bytes) {
      if (b < 0x20 || b > 0x7E) {
        return false;
      }
    }
    return true;
  }

  private static void releaseAll(List<MetadataEntry> entries) {
    for (MetadataEntry entry : entries) {
      entry.release();
    }
  }

  private static final class PluginState {
    final MetadataCallback callback;

    PluginState(MetadataCallback callback) {
      this.callback = checkNotNull(callback, "callback");
    }
  }
}
