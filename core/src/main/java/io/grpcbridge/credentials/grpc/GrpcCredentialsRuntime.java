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
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import io.grpc.CompositeCallCredentials;
import io.grpc.CompositeChannelCredentials;
import io.grpc.TlsChannelCredentials;
import io.grpcbridge.credentials.CallCredentialsHandle;
import io.grpcbridge.credentials.ChannelCredentialsHandle;
import io.grpcbridge.credentials.CredentialsHandle;
import io.grpcbridge.credentials.CredentialsRuntime;
import io.grpcbridge.credentials.MetadataCredentialsPlugin;
import io.grpcbridge.credentials.SslRootsOverride;
import io.grpcbridge.credentials.SslRootsOverrideCallback;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * A {@link CredentialsRuntime} producing grpc-java credentials: {@link TlsChannelCredentials} for
 * transport security, {@link PluginCallCredentials} for plugins, and grpc-java's composite types
 * for combinations.
 *
 * <p>Default roots are taken, in order, from the file named by {@value #ROOTS_FILE_PATH_FLAG}
 * (environment variable or system property), from the installed {@link SslRootsOverrideCallback},
 * and finally from the JDK's trust store.
 */
public final class GrpcCredentialsRuntime extends CredentialsRuntime {
  private static final Logger logger = Logger.getLogger(GrpcCredentialsRuntime.class.getName());

  public static final String ROOTS_FILE_PATH_FLAG = "GRPC_DEFAULT_SSL_ROOTS_FILE_PATH";

  @Nullable
  private final String rootsFilePath;
  @Nullable
  private volatile SslRootsOverrideCallback rootsOverride;

  public GrpcCredentialsRuntime() {
    this(getFlag(ROOTS_FILE_PATH_FLAG));
  }

  @VisibleForTesting
  GrpcCredentialsRuntime(@Nullable String rootsFilePath) {
    this.rootsFilePath = Strings.emptyToNull(rootsFilePath);
  }

  @Nullable
  private static String getFlag(String name) {
    String value = System.getenv(name);
    if (value == null) {
      value = System.getProperty(name);
    }
    return value;
  }

  @Override
  public CallCredentialsHandle createPluginCallCredentials(MetadataCredentialsPlugin plugin) {
    checkNotNull(plugin, "plugin");
    return new GrpcCallCredentialsHandle(
        new PluginCallCredentials(plugin), plugin, ImmutableList.<CredentialsHandle>of());
  }

  @Override
  @Nullable
  public CallCredentialsHandle createCompositeCallCredentials(
      CallCredentialsHandle first, CallCredentialsHandle second) {
    if (!(first instanceof GrpcCallCredentialsHandle)
        || !(second instanceof GrpcCallCredentialsHandle)) {
      logger.log(Level.FINE, "Cannot combine foreign call credentials {0} and {1}",
          new Object[] {first, second});
      return null;
    }
    GrpcCallCredentialsHandle grpcFirst = (GrpcCallCredentialsHandle) first;
    GrpcCallCredentialsHandle grpcSecond = (GrpcCallCredentialsHandle) second;
    grpcFirst.retain();
    grpcSecond.retain();
    return new GrpcCallCredentialsHandle(
        new CompositeCallCredentials(
            grpcFirst.getGrpcCredentials(), grpcSecond.getGrpcCredentials()),
        null,
        ImmutableList.<CredentialsHandle>of(grpcFirst, grpcSecond));
  }

  @Override
  @Nullable
  public ChannelCredentialsHandle createDefaultChannelCredentials() {
    return createSslChannelCredentials(null, null, null);
  }

  @Override
  @Nullable
  public ChannelCredentialsHandle createSslChannelCredentials(
      @Nullable byte[] pemRootCerts, @Nullable byte[] pemPrivateKey,
      @Nullable byte[] pemCertChain) {
    if ((pemPrivateKey == null) != (pemCertChain == null)) {
      logger.log(Level.FINE, "Private key and certificate chain must be provided together");
      return null;
    }
    byte[] roots = pemRootCerts != null ? pemRootCerts : defaultRoots();
    TlsChannelCredentials.Builder builder = TlsChannelCredentials.newBuilder();
    try {
      if (roots != null) {
        builder.trustManager(new ByteArrayInputStream(roots));
      }
      if (pemPrivateKey != null) {
        builder.keyManager(
            new ByteArrayInputStream(pemCertChain), new ByteArrayInputStream(pemPrivateKey));
      }
    } catch (IOException e) {
      logger.log(Level.WARNING, "Unable to read TLS key material", e);
      return null;
    }
    return new GrpcChannelCredentialsHandle(builder.build(), ImmutableList.<CredentialsHandle>of());
  }

  @Override
  @Nullable
  public ChannelCredentialsHandle createCompositeChannelCredentials(
      ChannelCredentialsHandle channelCredentials, CallCredentialsHandle callCredentials) {
    if (!(channelCredentials instanceof GrpcChannelCredentialsHandle)
        || !(callCredentials instanceof GrpcCallCredentialsHandle)) {
      logger.log(Level.FINE, "Cannot combine foreign credentials {0} and {1}",
          new Object[] {channelCredentials, callCredentials});
      return null;
    }
    GrpcChannelCredentialsHandle grpcChannel = (GrpcChannelCredentialsHandle) channelCredentials;
    GrpcCallCredentialsHandle grpcCall = (GrpcCallCredentialsHandle) callCredentials;
    grpcChannel.retain();
    grpcCall.retain();
    return new GrpcChannelCredentialsHandle(
        CompositeChannelCredentials.create(
            grpcChannel.getGrpcCredentials(), grpcCall.getGrpcCredentials()),
        ImmutableList.<CredentialsHandle>of(grpcChannel, grpcCall));
  }

  @Override
  public void setSslRootsOverrideCallback(SslRootsOverrideCallback callback) {
    this.rootsOverride = checkNotNull(callback, "callback");
  }

  @Nullable
  @VisibleForTesting
  byte[] defaultRoots() {
    if (rootsFilePath != null) {
      try {
        return Files.readAllBytes(Paths.get(rootsFilePath));
      } catch (IOException e) {
        logger.log(Level.WARNING, "Unable to read default roots from " + rootsFilePath, e);
      }
    }
    SslRootsOverrideCallback callback = rootsOverride;
    if (callback != null) {
      SslRootsOverride override = callback.getRootsOverride();
      if (override.isOk()) {
        return override.getPemRootCerts();
      }
    }
    return null;
  }
}
