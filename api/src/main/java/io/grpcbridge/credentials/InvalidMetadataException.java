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

/**
 * A metadata entry returned by a {@link MetadataCallback} could not be represented on the wire.
 * Reported to the runtime as {@code INVALID_ARGUMENT}; never thrown out of the plugin.
 */
final class InvalidMetadataException extends Exception {
  private static final long serialVersionUID = 1L;

  InvalidMetadataException(String message) {
    super(message);
  }

  InvalidMetadataException(String message, Throwable cause) {
    super(message, cause);
  }
}
