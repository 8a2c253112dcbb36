/*
 * (C) Copyright 2015 Kurento (http://kurento.org/)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.kurento.relay.internal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Test;
import org.kurento.client.Continuation;
import org.kurento.client.KurentoClient;
import org.kurento.client.MediaPipeline;
import org.kurento.commons.exception.KurentoException;
import org.kurento.relay.FakeMediaEngine;
import org.kurento.relay.api.KurentoClientProvider;
import org.kurento.relay.api.RelayHandler;
import org.kurento.relay.api.pojo.RtpCapabilities;
import org.kurento.relay.api.pojo.TransportRole;
import org.kurento.relay.exception.RelayException;
import org.kurento.relay.exception.RelayException.Code;

public class KurentoMediaEngineTest {

  private final RelayHandler handler = mock(RelayHandler.class);

  private KurentoMediaEngine engine(KurentoClientProvider provider) {
    KurentoMediaEngine engine = new KurentoMediaEngine(provider, handler,
        new KurentoEngineSettings());
    engine.init();
    return engine;
  }

  @Test
  public void unreachableMediaServerLeavesEngineUnavailable() {
    KurentoClientProvider provider = mock(KurentoClientProvider.class);
    when(provider.getKurentoClient()).thenThrow(
        new RelayException(Code.ENGINE_UNAVAILABLE_ERROR_CODE, "Unable to connect"));

    KurentoMediaEngine engine = engine(provider);

    assertFalse(engine.isAvailable());
    RelayException e = assertThrows(RelayException.class, engine::getCapabilities);
    assertEquals(Code.ENGINE_UNAVAILABLE_ERROR_CODE, e.getCode());
    RelayException transport = assertThrows(RelayException.class,
        () -> engine.openTransport("a", TransportRole.PRODUCING));
    assertEquals(Code.ENGINE_UNAVAILABLE_ERROR_CODE, transport.getCode());
    assertFalse(engine.canConsume("producer-1", FakeMediaEngine.engineCapabilities()));
  }

  @Test
  public void pipelineCreationFailureLeavesEngineUnavailable() {
    KurentoClient client = mock(KurentoClient.class);
    when(client.createMediaPipeline()).thenThrow(new KurentoException("no resources"));
    KurentoClientProvider provider = mock(KurentoClientProvider.class);
    when(provider.getKurentoClient()).thenReturn(client);

    assertFalse(engine(provider).isAvailable());
  }

  @Test
  @SuppressWarnings("unchecked")
  public void capabilitiesAreTheConfiguredCodecs() {
    MediaPipeline pipeline = mock(MediaPipeline.class);
    KurentoClient client = mock(KurentoClient.class);
    when(client.createMediaPipeline()).thenReturn(pipeline);
    KurentoClientProvider provider = mock(KurentoClientProvider.class);
    when(provider.getKurentoClient()).thenReturn(client);
    when(provider.destroyWhenUnused()).thenReturn(true);

    KurentoMediaEngine engine = engine(provider);

    assertTrue(engine.isAvailable());
    RtpCapabilities capabilities = engine.getCapabilities();
    assertEquals(KurentoEngineSettings.defaultCodecs().size(), capabilities.getCodecs().size());
    assertEquals("audio/opus", capabilities.getCodecs().get(0).getMimeType());

    engine.close();

    assertFalse(engine.isAvailable());
    verify(pipeline).release(any(Continuation.class));
    verify(client).destroy();
  }

  @Test
  public void tapDescriptionTargetsEncoderPort() {
    KurentoMediaEngine engine = new KurentoMediaEngine(mock(KurentoClientProvider.class), handler,
        new KurentoEngineSettings());

    String sdp = engine.tapSessionDescription("127.0.0.1", 40002);

    assertTrue(sdp.startsWith("v=0\r\n"));
    assertTrue(sdp.contains("c=IN IP4 127.0.0.1\r\n"));
    assertTrue(sdp.contains("m=video 40002 RTP/AVP 96\r\n"));
    assertTrue(sdp.contains("a=rtpmap:96 H264/90000\r\n"));
    assertTrue(sdp.contains("a=fmtp:96 packetization-mode=1\r\n"));
  }
}
