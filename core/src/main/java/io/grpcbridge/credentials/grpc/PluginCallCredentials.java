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

package io.grpcbridge.credentials.grpc;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.annotations.VisibleForTesting;
import io.grpc.CallCredentials;
import io.grpc.Metadata;
import io.grpc.MethodDescriptor;
import io.grpc.Status;
import io.grpcbridge.credentials.AuthMetadataContext;
import io.grpcbridge.credentials.MetadataCallbackException;
import io.grpcbridge.credentials.MetadataCredentialsPlugin;
import io.grpcbridge.credentials.MetadataEntry;
import io.grpcbridge.credentials.SyncMetadataResult;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * grpc-java {@link CallCredentials} that obtain their metadata from a {@link
 * MetadataCredentialsPlugin}, once per call, on the application executor.
 */
final class PluginCallCredentials extends CallCredentials {
  private static final Logger logger = Logger.getLogger(PluginCallCredentials.class.getName());

  private final MetadataCredentialsPlugin plugin;

  PluginCallCredentials(MetadataCredentialsPlugin plugin) {
    this.plugin = checkNotNull(plugin, "plugin");
  }

  @Override
  public void applyRequestMetadata(
      RequestInfo requestInfo, Executor appExecutor, final MetadataApplier applier) {
    final AuthMetadataContext context =
        createContext(requestInfo.getAuthority(), requestInfo.getMethodDescriptor());
    appExecutor.execute(new Runnable() {
      @Override
      public void run() {
        applyMetadata(context, applier);
      }
    });
  }

  @Override
  public void thisUsesUnstableApi() {}

  @VisibleForTesting
  void applyMetadata(AuthMetadataContext context, MetadataApplier applier) {
    SyncMetadataResult result = new SyncMetadataResult();
    try {
      plugin.getMetadata(context, result);
    } catch (RuntimeException e) {
      logger.log(Level.FINE, "Metadata plugin " + plugin.getType() + " failed", e);
      Status status = e instanceof MetadataCallbackException && e.getCause() instanceof IOException
          ? Status.UNAVAILABLE : Status.UNAUTHENTICATED;
      applier.fail(status.withDescription("Failed computing credential metadata").withCause(e));
      return;
    }

    Metadata headers;
    try {
      if (result.getStatusCode() != Status.Code.OK) {
        applier.fail(Status.fromCode(result.getStatusCode())
            .withDescription(result.getErrorDetails()));
        return;
      }
      headers = toHeaders(result);
    } catch (IllegalArgumentException e) {
      applier.fail(Status.INTERNAL.withDescription("Invalid plugin metadata").withCause(e));
      return;
    } finally {
      result.releaseEntries();
    }
    applier.apply(headers);
  }

  private static Metadata toHeaders(SyncMetadataResult result) {
    Metadata headers = new Metadata();
    for (MetadataEntry entry : result.getEntries()) {
      String name = entry.getKey().toStringUtf8();
      if (entry.isBinary()) {
        headers.put(Metadata.Key.of(name, Metadata.BINARY_BYTE_MARSHALLER),
            entry.getValue().toByteArray());
      } else {
        headers.put(Metadata.Key.of(name, Metadata.ASCII_STRING_MARSHALLER),
            new String(entry.getValue().toByteArray(), StandardCharsets.US_ASCII));
      }
    }
    return headers;
  }

  /**
   * Builds the context the way other gRPC implementations do: the service URL is the https URL
   * of the service on the call's authority, without the default port.
   */
  @VisibleForTesting
  static AuthMetadataContext createContext(String authority, MethodDescriptor<?, ?> method) {
    String host = authority;
    if (host.endsWith(":443")) {
      host = host.substring(0, host.length() - ":443".length());
    }
    String serviceName = method.getServiceName();
    String serviceUrl = "https://" + host + "/" + (serviceName == null ? "" : serviceName);
    String methodName = method.getBareMethodName();
    return new AuthMetadataContext(serviceUrl, methodName == null ? "" : methodName);
  }

  @Override
  public String toString() {
    return "PluginCallCredentials{" + plugin.getType() + "}";
  }
}
