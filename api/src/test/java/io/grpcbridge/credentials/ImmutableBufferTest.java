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
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import java.nio.ByteBuffer;
import java.nio.ReadOnlyBufferException;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Unit tests for {@link ImmutableBuffer}. */
@RunWith(JUnit4.class)
public class ImmutableBufferTest {

  @Test
  public void fromBytes_copiesInput() {
    byte[] input = "abc".getBytes(UTF_8);
    ImmutableBuffer buffer = ImmutableBuffer.fromBytes(input);
    input[0] = 'z';

    assertThat(buffer.toStringUtf8()).isEqualTo("abc");
    assertThat(buffer.size()).isEqualTo(3);
    assertThat(buffer.refCnt()).isEqualTo(1);
  }

  @Test
  public void readOnlyView_rejectsWrites() {
    ImmutableBuffer buffer = ImmutableBuffer.copyFromUtf8("abc");
    ByteBuffer view = buffer.asReadOnlyByteBuffer();

    assertThat(view.remaining()).isEqualTo(3);
    assertThrows(ReadOnlyBufferException.class, () -> view.put((byte) 1));
  }

  @Test
  public void equality_byContent() {
    ImmutableBuffer a = ImmutableBuffer.copyFromUtf8("token");
    ImmutableBuffer b = ImmutableBuffer.fromBytes("token".getBytes(UTF_8));
    b.retain();

    assertThat(a).isEqualTo(b);
    assertThat(a.hashCode()).isEqualTo(b.hashCode());
    assertThat(a).isNotEqualTo(ImmutableBuffer.copyFromUtf8("other"));
    assertThat(ImmutableBuffer.empty()).isEqualTo(ImmutableBuffer.fromBytes(new byte[0]));
  }

  @Test
  public void sharedSlice_sharesStorageAndCount() {
    ImmutableBuffer source = ImmutableBuffer.copyFromUtf8("Bearer abc");
    ImmutableBuffer slice = ImmutableBuffer.fromSharedSlice(source, 7, 3);

    assertThat(slice.toStringUtf8()).isEqualTo("abc");
    assertThat(source.refCnt()).isEqualTo(2);

    assertThat(source.release()).isFalse();
    assertThat(slice.toStringUtf8()).isEqualTo("abc");
    assertThat(slice.release()).isTrue();
    assertThrows(IllegalStateException.class, slice::toByteArray);
  }

  @Test
  public void sharedSlice_outOfBounds() {
    ImmutableBuffer source = ImmutableBuffer.copyFromUtf8("abc");

    assertThrows(IndexOutOfBoundsException.class,
        () -> ImmutableBuffer.fromSharedSlice(source, 2, 5));
    assertThat(source.refCnt()).isEqualTo(1);
  }

  @Test
  public void release_lastReferenceDropsContent() {
    ImmutableBuffer buffer = ImmutableBuffer.copyFromUtf8("abc");
    buffer.retain();

    assertThat(buffer.release()).isFalse();
    assertThat(buffer.release()).isTrue();
    assertThrows(IllegalStateException.class, buffer::toStringUtf8);
    assertThrows(IllegalStateException.class, buffer::asReadOnlyByteBuffer);
  }

  @Test
  public void release_tooManyTimesThrows() {
    ImmutableBuffer buffer = ImmutableBuffer.copyFromUtf8("abc");
    buffer.release();

    assertThrows(IllegalStateException.class, buffer::release);
    assertThrows(IllegalStateException.class, buffer::retain);
  }

  @Test
  public void contentEquals() {
    ImmutableBuffer buffer = ImmutableBuffer.copyFromUtf8("pem");

    assertThat(buffer.contentEquals("pem".getBytes(UTF_8))).isTrue();
    assertThat(buffer.contentEquals("pen".getBytes(UTF_8))).isFalse();
    assertThat(buffer.contentEquals("pems".getBytes(UTF_8))).isFalse();
  }
}
