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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.grpc.Status;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnit;
import org.mockito.junit.MockitoRule;

/** Unit tests for {@link MetadataBridge}. */
@RunWith(JUnit4.class)
public class MetadataBridgeTest {
  private static final AuthMetadataContext CONTEXT =
      new AuthMetadataContext("https://svc", "Get");

  @Rule
  public final MockitoRule mocks = MockitoJUnit.rule();

  @Mock
  private MetadataCallback callback;

  private final SyncMetadataResult result = new SyncMetadataResult();

  @Test
  public void singleEntry() throws Exception {
    when(callback.getMetadata(any(AuthMetadataContext.class)))
        .thenReturn(ImmutableMap.of("authorization", "Bearer abc"));
    MetadataBridge bridge = new MetadataBridge(callback);

    assertThat(bridge.getMetadata(CONTEXT, result)).isTrue();

    assertThat(result.getStatusCode()).isEqualTo(Status.Code.OK);
    assertThat(result.getNumEntries()).isEqualTo(1);
    assertThat(result.getErrorDetails()).isNull();
    assertThat(result.getEntry(0)).isEqualTo(MetadataEntry.of("authorization", "Bearer abc"));
  }

  @Test
  public void callbackReceivesCopiedContext() throws Exception {
    when(callback.getMetadata(any(AuthMetadataContext.class)))
        .thenReturn(ImmutableMap.of());
    MetadataBridge bridge = new MetadataBridge(callback);

    bridge.getMetadata(CONTEXT, result);

    ArgumentCaptor<AuthMetadataContext> captor =
        ArgumentCaptor.forClass(AuthMetadataContext.class);
    verify(callback).getMetadata(captor.capture());
    assertThat(captor.getValue()).isNotSameInstanceAs(CONTEXT);
    assertThat(captor.getValue().getServiceUrl()).isEqualTo("https://svc");
    assertThat(captor.getValue().getMethodName()).isEqualTo("Get");
    assertThat(result.getStatusCode()).isEqualTo(Status.Code.OK);
    assertThat(result.getNumEntries()).isEqualTo(0);
  }

  @Test
  public void entriesKeepOrder() throws Exception {
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("x-b", "2");
    metadata.put("x-a", ImmutableList.of("1", "3"));
    metadata.put("trace-bin", new byte[] {0, (byte) 0xff});
    when(callback.getMetadata(any(AuthMetadataContext.class))).thenReturn(metadata);

    new MetadataBridge(callback).getMetadata(CONTEXT, result);

    assertThat(result.getStatusCode()).isEqualTo(Status.Code.OK);
    assertThat(result.getEntries()).containsExactly(
        MetadataEntry.of("x-b", "2"),
        MetadataEntry.of("x-a", "1"),
        MetadataEntry.of("x-a", "3"),
        new MetadataEntry(ImmutableBuffer.copyFromUtf8("trace-bin"),
            ImmutableBuffer.fromBytes(new byte[] {0, (byte) 0xff})))
        .inOrder();
  }

  @Test
  public void maxEntriesAccepted() throws Exception {
    when(callback.getMetadata(any(AuthMetadataContext.class))).thenReturn(
        ImmutableMap.of("k1", "v1", "k2", "v2", "k3", "v3", "k4", "v4"));

    new MetadataBridge(callback).getMetadata(CONTEXT, result);

    assertThat(result.getStatusCode()).isEqualTo(Status.Code.OK);
    assertThat(result.getNumEntries()).isEqualTo(MetadataCredentialsPlugin.MAX_SYNC_METADATA);
  }

  @Test
  public void tooManyEntries_reportsInternal() throws Exception {
    when(callback.getMetadata(any(AuthMetadataContext.class))).thenReturn(
        ImmutableMap.of("k1", "v1", "k2", "v2", "k3", "v3", "k4", "v4", "k5", "v5"));

    assertThat(new MetadataBridge(callback).getMetadata(CONTEXT, result)).isTrue();

    assertThat(result.getStatusCode()).isEqualTo(Status.Code.INTERNAL);
    assertThat(result.getNumEntries()).isEqualTo(0);
    assertThat(result.getErrorDetails()).isEqualTo(MetadataBridge.TOO_MANY_ENTRIES_DETAILS);
  }

  @Test
  public void repeatedValuesCountTowardsLimit() throws Exception {
    when(callback.getMetadata(any(AuthMetadataContext.class))).thenReturn(
        ImmutableMap.of("k", new String[] {"1", "2", "3", "4", "5"}));

    new MetadataBridge(callback).getMetadata(CONTEXT, result);

    assertThat(result.getStatusCode()).isEqualTo(Status.Code.INTERNAL);
  }

  @Test
  public void nonMapResult_throws() throws Exception {
    when(callback.getMetadata(any(AuthMetadataContext.class))).thenReturn("Bearer abc");
    MetadataBridge bridge = new MetadataBridge(callback);

    InvalidCallbackResultException e = assertThrows(InvalidCallbackResultException.class,
        () -> bridge.getMetadata(CONTEXT, result));
    assertThat(e).hasMessageThat().contains("java.lang.String");
  }

  @Test
  public void nullResult_throws() throws Exception {
    when(callback.getMetadata(any(AuthMetadataContext.class))).thenReturn(null);
    MetadataBridge bridge = new MetadataBridge(callback);

    assertThrows(InvalidCallbackResultException.class, () -> bridge.getMetadata(CONTEXT, result));
  }

  @Test
  public void illegalKey_reportsInvalidArgument() throws Exception {
    when(callback.getMetadata(any(AuthMetadataContext.class)))
        .thenReturn(ImmutableMap.of("Authorization", "Bearer abc"));

    assertThat(new MetadataBridge(callback).getMetadata(CONTEXT, result)).isTrue();

    assertThat(result.getStatusCode()).isEqualTo(Status.Code.INVALID_ARGUMENT);
    assertThat(result.getNumEntries()).isEqualTo(0);
    assertThat(result.getErrorDetails()).isNull();
  }

  @Test
  public void nonStringKey_reportsInvalidArgument() throws Exception {
    when(callback.getMetadata(any(AuthMetadataContext.class)))
        .thenReturn(ImmutableMap.of(42, "value"));

    new MetadataBridge(callback).getMetadata(CONTEXT, result);

    assertThat(result.getStatusCode()).isEqualTo(Status.Code.INVALID_ARGUMENT);
  }

  @Test
  public void unsupportedValue_reportsInvalidArgument() throws Exception {
    when(callback.getMetadata(any(AuthMetadataContext.class)))
        .thenReturn(ImmutableMap.of("x-count", 42));

    new MetadataBridge(callback).getMetadata(CONTEXT, result);

    assertThat(result.getStatusCode()).isEqualTo(Status.Code.INVALID_ARGUMENT);
    assertThat(result.getNumEntries()).isEqualTo(0);
  }

  @Test
  public void binaryValueForAsciiKey_reportsInvalidArgument() throws Exception {
    when(callback.getMetadata(any(AuthMetadataContext.class)))
        .thenReturn(ImmutableMap.of("x-token", new byte[] {1, 2}));

    new MetadataBridge(callback).getMetadata(CONTEXT, result);

    assertThat(result.getStatusCode()).isEqualTo(Status.Code.INVALID_ARGUMENT);
  }

  @Test
  public void invalidEntryAfterValidOnes_releasesEarlierEntries() throws Exception {
    ImmutableBuffer shared = ImmutableBuffer.copyFromUtf8("token");
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("x-ok", shared);
    metadata.put("x-bad", new Object());
    when(callback.getMetadata(any(AuthMetadataContext.class))).thenReturn(metadata);

    new MetadataBridge(callback).getMetadata(CONTEXT, result);

    assertThat(result.getStatusCode()).isEqualTo(Status.Code.INVALID_ARGUMENT);
    assertThat(shared.refCnt()).isEqualTo(1);
  }

  @Test
  public void outputEntriesOutliveBridgeWorkingSet() throws Exception {
    ImmutableBuffer shared = ImmutableBuffer.copyFromUtf8("Bearer abc");
    when(callback.getMetadata(any(AuthMetadataContext.class)))
        .thenReturn(ImmutableMap.of("authorization", shared));

    new MetadataBridge(callback).getMetadata(CONTEXT, result);

    // One reference held by the callback's buffer, one by the output entry.
    assertThat(shared.refCnt()).isEqualTo(2);
    MetadataEntry entry = result.getEntry(0);
    assertThat(entry.getKey().refCnt()).isEqualTo(1);
    assertThat(entry.getValue().toStringUtf8()).isEqualTo("Bearer abc");

    result.releaseEntries();
    assertThat(shared.refCnt()).isEqualTo(1);
    assertThat(entry.getKey().refCnt()).isEqualTo(0);
  }

  @Test
  public void callbackFailure_propagates() throws Exception {
    IOException failure = new IOException("token server unreachable");
    when(callback.getMetadata(any(AuthMetadataContext.class))).thenThrow(failure);
    MetadataBridge bridge = new MetadataBridge(callback);

    MetadataCallbackException e = assertThrows(MetadataCallbackException.class,
        () -> bridge.getMetadata(CONTEXT, result));
    assertThat(e).hasCauseThat().isSameInstanceAs(failure);
  }

  @Test
  public void destroy_onlyOnce() {
    MetadataBridge bridge = new MetadataBridge(callback);

    bridge.destroy();

    assertThat(bridge.isDestroyed()).isTrue();
    assertThrows(IllegalStateException.class, bridge::destroy);
    assertThrows(IllegalStateException.class, () -> bridge.getMetadata(CONTEXT, result));
  }

  @Test
  public void reusableAfterProtocolFailure() throws Exception {
    when(callback.getMetadata(any(AuthMetadataContext.class)))
        .thenReturn(ImmutableMap.of("BAD", "x"))
        .thenReturn(ImmutableMap.of("good", "x"));
    MetadataBridge bridge = new MetadataBridge(callback);

    bridge.getMetadata(CONTEXT, result);
    assertThat(result.getStatusCode()).isEqualTo(Status.Code.INVALID_ARGUMENT);

    SyncMetadataResult second = new SyncMetadataResult();
    bridge.getMetadata(CONTEXT, second);
    assertThat(second.getStatusCode()).isEqualTo(Status.Code.OK);
    assertThat(second.getEntries()).containsExactly(MetadataEntry.of("good", "x"));
  }

  @Test
  public void utf8ValueOnAsciiKey_rejected() throws Exception {
    when(callback.getMetadata(any(AuthMetadataContext.class)))
        .thenReturn(ImmutableMap.of("x-name", "caf\u00e9"));

    new MetadataBridge(callback).getMetadata(CONTEXT, result);

    assertThat(result.getStatusCode()).isEqualTo(Status.Code.INVALID_ARGUMENT);
  }

  @Test
  public void interruptedCallback_restoresInterruptFlag() throws Exception {
    InterruptedException interrupted = new InterruptedException("cancelled");
    when(callback.getMetadata(any(AuthMetadataContext.class))).thenThrow(interrupted);
    MetadataBridge bridge = new MetadataBridge(callback);

    try {
      MetadataCallbackException e = assertThrows(MetadataCallbackException.class,
          () -> bridge.getMetadata(CONTEXT, result));
      assertThat(e).hasCauseThat().isSameInstanceAs(interrupted);
      assertThat(Thread.currentThread().isInterrupted()).isTrue();
    } finally {
      Thread.interrupted();
    }
  }

  @Test
  public void releasedBufferValue_reportsInvalidArgument() throws Exception {
    ImmutableBuffer released = ImmutableBuffer.copyFromUtf8("Bearer abc");
    released.release();
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("x-ok", "1");
    metadata.put("authorization", released);
    when(callback.getMetadata(any(AuthMetadataContext.class))).thenReturn(metadata);

    assertThat(new MetadataBridge(callback).getMetadata(CONTEXT, result)).isTrue();

    assertThat(result.getStatusCode()).isEqualTo(Status.Code.INVALID_ARGUMENT);
    assertThat(result.getNumEntries()).isEqualTo(0);
    assertThat(result.getErrorDetails()).isNull();
  }

  @Test
  public void primitiveArrayValue_reportsInvalidArgument() throws Exception {
    when(callback.getMetadata(any(AuthMetadataContext.class)))
        .thenReturn(ImmutableMap.of("x-ids", new int[] {1, 2}));

    new MetadataBridge(callback).getMetadata(CONTEXT, result);

    assertThat(result.getStatusCode()).isEqualTo(Status.Code.INVALID_ARGUMENT);
  }

  @Test
  public void reusedResult_releasesPreviousEntries() throws Exception {
    ImmutableBuffer first = ImmutableBuffer.copyFromUtf8("Bearer one");
    when(callback.getMetadata(any(AuthMetadataContext.class)))
        .thenReturn(ImmutableMap.of("authorization", first))
        .thenReturn(ImmutableMap.of("authorization", "Bearer two"));
    MetadataBridge bridge = new MetadataBridge(callback);

    bridge.getMetadata(CONTEXT, result);
    assertThat(first.refCnt()).isEqualTo(2);

    bridge.getMetadata(CONTEXT, result);

    assertThat(first.refCnt()).isEqualTo(1);
    assertThat(result.getEntries())
        .containsExactly(MetadataEntry.of("authorization", "Bearer two"));
  }
}
