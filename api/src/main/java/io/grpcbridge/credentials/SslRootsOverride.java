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

import javax.annotation.Nullable;

/** Result of {@link SslRootsOverrideCallback#getRootsOverride()}. */
public final class SslRootsOverride {
  /** Outcome of a roots override query. */
  public enum Result {
    /** Override roots were supplied. */
    OK,
    /** No override is available; the runtime falls back to its own defaults. */
    FAIL
  }

  private static final SslRootsOverride FAIL = new SslRootsOverride(Result.FAIL, null);

  private final Result result;
  @Nullable
  private final byte[] pemRootCerts;

  private SslRootsOverride(Result result, @Nullable byte[] pemRootCerts) {
    this.result = result;
    this.pemRootCerts = pemRootCerts;
  }

  /** Returns an {@code OK} result handing {@code pemRootCerts} over to the caller. */
  public static SslRootsOverride ok(byte[] pemRootCerts) {
    return new SslRootsOverride(Result.OK, checkNotNull(pemRootCerts, "pemRootCerts"));
  }

  public static SslRootsOverride fail() {
    return FAIL;
  }

  public Result getResult() {
    return result;
  }

  public boolean isOk() {
    return result == Result.OK;
  }

  /**
   * The PEM bundle supplied by an {@code OK} result.
   *
   * @throws IllegalStateException if the result is {@code FAIL}
   */
  public byte[] getPemRootCerts() {
    checkState(pemRootCerts != null, "no roots in a %s result", result);
    return pemRootCerts;
  }
}
