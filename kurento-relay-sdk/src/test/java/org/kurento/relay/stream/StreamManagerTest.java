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
package org.kurento.relay.stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.kurento.relay.FakeMediaEngine;
import org.kurento.relay.RecordingNotifier;
import org.kurento.relay.api.pojo.MediaKind;
import org.kurento.relay.exception.RelayException;
import org.kurento.relay.exception.RelayException.Code;
import org.kurento.relay.internal.ProtocolElements;
import org.kurento.relay.recording.HlsRecorderFactory;
import org.kurento.relay.recording.RecordingSettings;
import org.kurento.relay.recording.StubEncoderLauncher;
import org.kurento.relay.registry.ProducerRecord;
import org.kurento.relay.registry.SessionRegistry;

public class StreamManagerTest {

  @TempDir
  Path hlsRoot;

  private FakeMediaEngine engine;
  private SessionRegistry registry;
  private StubEncoderLauncher launcher;
  private RecordingNotifier notifier;
  private HlsRecorderFactory factory;
  private StreamManager manager;

  @BeforeEach
  public void setup() {
    engine = new FakeMediaEngine();
    registry = new SessionRegistry();
    launcher = new StubEncoderLauncher();
    notifier = new RecordingNotifier();

    RecordingSettings settings = new RecordingSettings();
    settings.setHlsRoot(hlsRoot);
    settings.setPlaybackPrefix("/hls/");
    settings.setStartupTimeoutMillis(300);
    settings.setReadinessPollMillis(10);
    settings.setStopTimeoutMillis(500);
    factory = new HlsRecorderFactory(engine, registry, settings, launcher,
        (address, port) -> true);
    manager = new StreamManager(registry, factory, notifier);

    for (String clientId : Arrays.asList("a", "b", "c")) {
      registry.register(clientId);
      notifier.connect(clientId);
    }
  }

  @AfterEach
  public void tearDown() {
    manager.close();
  }

  private void addVideoProducer(String clientId, String producerId) {
    registry.upsertProducer(clientId, new ProducerRecord(producerId, MediaKind.VIDEO, clientId));
  }

  private static void await(BooleanSupplier condition) throws InterruptedException {
    long deadline = System.currentTimeMillis() + 5000;
    while (!condition.getAsBoolean()) {
      assertTrue(System.currentTimeMillis() < deadline, "condition not met in time");
      Thread.sleep(10);
    }
  }

  @Test
  public void groupWithoutVideoStaysActive() {
    StreamInfo info = manager.startBroadcast("a", "room1");

    assertEquals("room1", info.getStreamKey());
    assertEquals(StreamState.ACTIVE, info.getState());
    assertNull(info.getPlaylistUrl());
    assertEquals(Arrays.asList("a"), info.getMembers());
    assertTrue(launcher.commands.isEmpty());
    assertTrue(notifier.getEvents(ProtocolElements.STREAMLIVE_METHOD).isEmpty());
  }

  @Test
  public void groupWithVideoStartsRecording() {
    addVideoProducer("a", "p1");

    StreamInfo info = manager.startBroadcast("a", "room1");

    assertEquals(StreamState.RECORDING, info.getState());
    assertEquals("/hls/room1/playlist.m3u8", info.getPlaylistUrl());
    assertEquals(1, launcher.commands.size());
    assertEquals(1, engine.connectedTaps.size());
    assertEquals(3, notifier.getEvents(ProtocolElements.STREAMLIVE_METHOD).size());
    assertEquals("room1", notifier.getEvents("b", ProtocolElements.STREAMLIVE_METHOD).get(0).params
        .get(ProtocolElements.HLSSTREAM_STREAMID_PARAM).getAsString());
  }

  @Test
  public void repeatedStartKeepsSingleRecorder() {
    addVideoProducer("a", "p1");

    manager.startBroadcast("a", "room1");
    StreamInfo info = manager.startBroadcast("b", "room1");

    assertEquals(Arrays.asList("a", "b"), info.getMembers());
    assertEquals(1, launcher.commands.size());
    assertEquals(1, notifier.getEvents("c", ProtocolElements.STREAMLIVE_METHOD).size());
  }

  @Test
  public void concurrentStartsLaunchSingleEncoder() throws Exception {
    addVideoProducer("a", "p1");
    final CountDownLatch gate = new CountDownLatch(1);
    ExecutorService pool = Executors.newFixedThreadPool(3);
    try {
      List<Future<StreamInfo>> results = new ArrayList<Future<StreamInfo>>();
      for (final String clientId : Arrays.asList("a", "b", "c")) {
        results.add(pool.submit(() -> {
          gate.await();
          return manager.startBroadcast(clientId, "room1");
        }));
      }
      gate.countDown();
      for (Future<StreamInfo> result : results) {
        assertEquals(StreamState.RECORDING, result.get(5, TimeUnit.SECONDS).getState());
      }
    } finally {
      pool.shutdownNow();
    }

    assertEquals(1, launcher.commands.size());
    assertEquals(1, engine.taps.size());
    assertEquals(3, manager.getStream("room1").getMembers().size());
    for (String clientId : Arrays.asList("a", "b", "c")) {
      assertEquals(1, notifier.getEvents(clientId, ProtocolElements.STREAMLIVE_METHOD).size());
    }
  }

  @Test
  public void videoProducerArrivingLaterAttachesRecorder() {
    manager.startBroadcast("a", "room1");
    addVideoProducer("b", "p1");

    manager.onVideoProducerAvailable("p1");

    StreamInfo info = manager.getStream("room1");
    assertEquals(StreamState.RECORDING, info.getState());
    assertEquals(1, notifier.getEvents("a", ProtocolElements.STREAMLIVE_METHOD).size());

    manager.onVideoProducerAvailable("p1");
    assertEquals(1, launcher.commands.size());
  }

  @Test
  public void nonLastMemberStopKeepsRecording() {
    addVideoProducer("a", "p1");
    manager.startBroadcast("a", "room1");
    manager.startBroadcast("b", "room1");

    manager.stopBroadcast("a", "room1");

    StreamInfo info = manager.getStream("room1");
    assertEquals(Arrays.asList("b"), info.getMembers());
    assertEquals(StreamState.RECORDING, info.getState());
    assertFalse(launcher.last().isDestroyed());
    assertTrue(notifier.getEvents(ProtocolElements.STREAMENDED_METHOD).isEmpty());
  }

  @Test
  public void lastMemberStopEndsTheStream() {
    addVideoProducer("a", "p1");
    manager.startBroadcast("a", "room1");

    manager.stopBroadcast("a", "room1");

    assertNull(manager.getStream("room1"));
    assertTrue(manager.listStreams().isEmpty());
    assertTrue(launcher.last().isDestroyed());
    assertEquals(1, engine.closedTaps.size());
    assertEquals(1, notifier.getEvents("b", ProtocolElements.STREAMENDED_METHOD).size());
  }

  @Test
  public void emptyGroupWithoutRecorderIsRemovedSilently() {
    manager.startBroadcast("a", "room1");

    manager.stopBroadcast("a", "room1");

    assertNull(manager.getStream("room1"));
    assertTrue(manager.listStreams().isEmpty());
    assertTrue(notifier.getEvents(ProtocolElements.STREAMENDED_METHOD).isEmpty());
    RelayException e = assertThrows(RelayException.class,
        () -> manager.stopBroadcast("a", "room1"));
    assertEquals(Code.NOT_FOUND_ERROR_CODE, e.getCode());
  }

  @Test
  public void stopByNonMemberChangesNothing() {
    manager.startBroadcast("a", "room1");

    manager.stopBroadcast("b", "room1");

    assertEquals(Arrays.asList("a"), manager.getStream("room1").getMembers());
  }

  @Test
  public void stopOfUnknownStreamIsNotFound() {
    RelayException e = assertThrows(RelayException.class,
        () -> manager.stopBroadcast("a", "nothing"));

    assertEquals(Code.NOT_FOUND_ERROR_CODE, e.getCode());
  }

  @Test
  public void failedStartKeepsGroupAndCanBeRetried() {
    addVideoProducer("a", "p1");
    launcher.failure = new IOException("ffmpeg not found");

    RelayException e = assertThrows(RelayException.class,
        () -> manager.startBroadcast("a", "room1"));

    assertEquals(Code.RECORDER_START_FAILED_ERROR_CODE, e.getCode());
    StreamInfo kept = manager.getStream("room1");
    assertNotNull(kept);
    assertEquals(StreamState.ACTIVE, kept.getState());
    assertEquals(Arrays.asList("a"), kept.getMembers());
    assertEquals(1, engine.closedTaps.size());

    launcher.failure = null;
    StreamInfo retried = manager.startBroadcast("a", "room1");
    assertEquals(StreamState.RECORDING, retried.getState());
  }

  @Test
  public void disconnectLeavesEveryGroup() {
    addVideoProducer("a", "p1");
    manager.startBroadcast("a", "room1");
    manager.startBroadcast("a", "room2");
    manager.startBroadcast("b", "room2");

    manager.removeClient("a");

    assertNull(manager.getStream("room1"));
    assertEquals(Arrays.asList("b"), manager.getStream("room2").getMembers());
    assertEquals(1, manager.listStreams().size());
  }

  @Test
  public void closedSourceProducerMovesRecorderToNextVideo() {
    addVideoProducer("a", "p1");
    manager.startBroadcast("a", "room1");
    String firstTap = engine.connectedTaps.get(0);

    registry.removeProducer("a");
    addVideoProducer("b", "p2");
    manager.onProducerClosed("p1");

    assertTrue(engine.closedTaps.contains(firstTap));
    assertEquals(1, notifier.getEvents("c", ProtocolElements.STREAMENDED_METHOD).size());
    assertEquals(2, notifier.getEvents("c", ProtocolElements.STREAMLIVE_METHOD).size());
    assertEquals(StreamState.RECORDING, manager.getStream("room1").getState());
    assertEquals(2, launcher.commands.size());
  }

  @Test
  public void reattachIsDeferredToWorkers() {
    List<Runnable> queued = new CopyOnWriteArrayList<Runnable>();
    StreamManager deferred = new StreamManager(registry, factory, notifier, queued::add);
    try {
      addVideoProducer("a", "p1");
      deferred.startBroadcast("a", "room1");
      registry.removeProducer("a");
      addVideoProducer("b", "p2");

      deferred.onProducerClosed("p1");

      assertEquals(1, notifier.getEvents("c", ProtocolElements.STREAMENDED_METHOD).size());
      assertEquals(1, launcher.commands.size());
      assertEquals(StreamState.ACTIVE, deferred.getStream("room1").getState());
      assertEquals(1, queued.size());

      queued.get(0).run();

      assertEquals(2, launcher.commands.size());
      assertEquals(StreamState.RECORDING, deferred.getStream("room1").getState());
      assertEquals(2, notifier.getEvents("c", ProtocolElements.STREAMLIVE_METHOD).size());
    } finally {
      deferred.close();
    }
  }

  @Test
  public void reattachSkipsGroupRemovedMeanwhile() {
    List<Runnable> queued = new CopyOnWriteArrayList<Runnable>();
    StreamManager deferred = new StreamManager(registry, factory, notifier, queued::add);
    try {
      addVideoProducer("a", "p1");
      deferred.startBroadcast("b", "room1");
      registry.removeProducer("a");
      addVideoProducer("c", "p2");
      deferred.onProducerClosed("p1");
      deferred.stopBroadcast("b", "room1");

      queued.get(0).run();

      assertNull(deferred.getStream("room1"));
      assertEquals(1, launcher.commands.size());
    } finally {
      deferred.close();
    }
  }

  @Test
  public void closedSourceWithoutReplacementFallsBackToActive() {
    addVideoProducer("a", "p1");
    manager.startBroadcast("a", "room1");

    registry.removeProducer("a");
    manager.onProducerClosed("p1");

    StreamInfo info = manager.getStream("room1");
    assertEquals(StreamState.ACTIVE, info.getState());
    assertNull(info.getPlaylistUrl());
  }

  @Test
  public void crashedEncoderIsRestarted() throws Exception {
    addVideoProducer("a", "p1");
    manager.startBroadcast("a", "room1");

    launcher.last().exit(1);

    await(() -> launcher.processes.size() == 2);
    await(() -> notifier.getEvents("b", ProtocolElements.STREAMLIVE_METHOD).size() == 2);
    assertEquals(1, notifier.getEvents("b", ProtocolElements.STREAMENDED_METHOD).size());
    assertEquals(StreamState.RECORDING, manager.getStream("room1").getState());
  }

  @Test
  public void generatedKeyWhenNoneRequested() {
    StreamInfo info = manager.startBroadcast("a", null);

    assertTrue(info.getStreamKey().startsWith("stream_"));
  }

  @Test
  public void keysAreSanitized() {
    assertEquals("my_room_1", StreamManager.resolveKey("my room/1"));
    assertEquals("a-b_c", StreamManager.resolveKey("  a-b_c "));

    RelayException e = assertThrows(RelayException.class,
        () -> StreamManager.resolveKey("../"));
    assertEquals(Code.INVALID_REQUEST_ERROR_CODE, e.getCode());
  }

  @Test
  public void closedManagerRejectsNewBroadcasts() {
    addVideoProducer("a", "p1");
    manager.startBroadcast("a", "room1");

    manager.close();

    assertTrue(launcher.last().isDestroyed());
    RelayException e = assertThrows(RelayException.class,
        () -> manager.startBroadcast("a", "room2"));
    assertEquals(Code.ENGINE_UNAVAILABLE_ERROR_CODE, e.getCode());
  }
}
