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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Registry of {@link CredentialsRuntimeProvider}s. The {@link #getDefaultRegistry default
 * instance} loads providers at runtime through the Java service provider mechanism.
 *
 * <p>The first call to {@link #getRuntime} creates the runtime of the highest priority provider and
 * installs the process-wide default root certificates as its roots override. That runtime is then
 * used for the life of the registry.
 */
@ThreadSafe
public final class CredentialsRuntimeRegistry {
  private static final Logger logger = Logger.getLogger(CredentialsRuntimeRegistry.class.getName());
  private static CredentialsRuntimeRegistry instance;

  private final SslRootsOverrideCallback rootsOverride;
  @GuardedBy("this")
  private final LinkedHashSet<CredentialsRuntimeProvider> allProviders = new LinkedHashSet<>();
  /** Immutable, sorted version of {@code allProviders}. Is replaced instead of mutating. */
  @GuardedBy("this")
  private List<CredentialsRuntimeProvider> effectiveProviders = Collections.emptyList();
  @GuardedBy("this")
  private CredentialsRuntime runtime;

  @VisibleForTesting
  CredentialsRuntimeRegistry(SslRootsOverrideCallback rootsOverride) {
    this.rootsOverride = Preconditions.checkNotNull(rootsOverride, "rootsOverride");
  }

  /**
   * Register a provider.
   *
   * <p>If the provider's {@link CredentialsRuntimeProvider#isAvailable isAvailable()} returns
   * {@code false}, this method will throw {@link IllegalArgumentException}.
   *
   * <p>Providers will be used in priority order. In case of ties, providers are used in
   * registration order.
   */
  public synchronized void register(CredentialsRuntimeProvider provider) {
    addProvider(provider);
    refreshProviders();
  }

  private synchronized void addProvider(CredentialsRuntimeProvider provider) {
    Preconditions.checkArgument(provider.isAvailable(), "isAvailable() returned false");
    allProviders.add(provider);
  }

  /**
   * Deregisters a provider.  No-op if the provider is not in the registry. A runtime that was
   * already created is kept.
   */
  public synchronized void deregister(CredentialsRuntimeProvider provider) {
    allProviders.remove(provider);
    refreshProviders();
  }

  private synchronized void refreshProviders() {
    List<CredentialsRuntimeProvider> providers = new ArrayList<>(allProviders);
    // sort() must be stable, as we prefer first-registered providers
    Collections.sort(providers, Collections.reverseOrder(
        new Comparator<CredentialsRuntimeProvider>() {
          @Override
          public int compare(CredentialsRuntimeProvider o1, CredentialsRuntimeProvider o2) {
            return o1.priority() - o2.priority();
          }
        }));
    effectiveProviders = Collections.unmodifiableList(providers);
  }

  /**
   * Returns the default registry that loads providers via the Java service loader mechanism.
   */
  public static synchronized CredentialsRuntimeRegistry getDefaultRegistry() {
    if (instance == null) {
      instance = new CredentialsRuntimeRegistry(DefaultRootCertStore.getInstance());
      ClassLoader classLoader = CredentialsRuntimeProvider.class.getClassLoader();
      for (CredentialsRuntimeProvider provider : loadProviders(classLoader)) {
        logger.fine("Service loader found " + provider);
        if (provider.isAvailable()) {
          instance.addProvider(provider);
        }
      }
      instance.refreshProviders();
    }
    return instance;
  }

  private static List<CredentialsRuntimeProvider> loadProviders(ClassLoader classLoader) {
    LinkedHashSet<Class<?>> seen = new LinkedHashSet<>();
    List<CredentialsRuntimeProvider> providers = new ArrayList<>();
    try {
      for (CredentialsRuntimeProvider provider
          : ServiceLoader.load(CredentialsRuntimeProvider.class, classLoader)) {
        if (seen.add(provider.getClass())) {
          providers.add(provider);
        }
      }
    } catch (ServiceConfigurationError e) {
      logger.log(Level.WARNING, "Unable to load CredentialsRuntimeProvider services", e);
    }
    for (Class<?> klass : getHardCodedClasses()) {
      if (seen.add(klass)) {
        try {
          providers.add(klass.asSubclass(CredentialsRuntimeProvider.class)
              .getConstructor().newInstance());
        } catch (ReflectiveOperationException | ClassCastException e) {
          throw new ServiceConfigurationError("Provider " + klass.getName()
              + " could not be instantiated", e);
        }
      }
    }
    return providers;
  }

  @VisibleForTesting
  static List<Class<?>> getHardCodedClasses() {
    List<Class<?>> list = new ArrayList<>();
    try {
      list.add(Class.forName("io.grpcbridge.credentials.grpc.GrpcCredentialsRuntimeProvider"));
    } catch (ClassNotFoundException e) {
      logger.log(Level.FINE, "Unable to find GrpcCredentialsRuntimeProvider", e);
    }
    return Collections.unmodifiableList(list);
  }

  /**
   * Returns effective providers, in priority order.
   */
  @VisibleForTesting
  synchronized List<CredentialsRuntimeProvider> providers() {
    return effectiveProviders;
  }

  /**
   * Returns the runtime used by {@link CallCredentials} and {@link ChannelCredentials}, creating it
   * on first use.
   *
   * @throws ProviderNotFoundException if no provider is registered
   */
  public synchronized CredentialsRuntime getRuntime() {
    if (runtime == null) {
      if (effectiveProviders.isEmpty()) {
        throw new ProviderNotFoundException("No functional credentials runtime provider found. "
            + "Try adding a dependency on the grpc-credentials-bridge-core artifact");
      }
      CredentialsRuntimeProvider provider = effectiveProviders.get(0);
      CredentialsRuntime created = Preconditions.checkNotNull(
          provider.newRuntime(), "%s returned a null runtime", provider);
      created.setSslRootsOverrideCallback(rootsOverride);
      logger.log(Level.FINE, "Using credentials runtime {0}", created);
      runtime = created;
    }
    return runtime;
  }

  /** Thrown when no suitable {@link CredentialsRuntimeProvider} objects can be found. */
  public static final class ProviderNotFoundException extends RuntimeException {
    private static final long serialVersionUID = 1;

    public ProviderNotFoundException(String msg) {
      super(msg);
    }
  }
}
