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
package org.kurento.relay.recording;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.kurento.relay.FakeMediaEngine;
import org.kurento.relay.api.pojo.MediaKind;
import org.kurento.relay.api.pojo.TapHandle;
import org.kurento.relay.exception.RelayException;
import org.kurento.relay.exception.RelayException.Code;
import org.kurento.relay.registry.ProducerRecord;
import org.kurento.relay.registry.SessionRegistry;

public class HlsRecorderTest {

  @TempDir
  Path hlsRoot;

  private FakeMediaEngine engine;
  private SessionRegistry registry;
  private RecordingSettings settings;
  private StubEncoderLauncher launcher;
  private volatile boolean listening;
  private RecorderListener listener;

  @BeforeEach
  public void setup() {
    engine = new FakeMediaEngine();
    registry = new SessionRegistry();
    settings = new RecordingSettings();
    settings.setHlsRoot(hlsRoot);
    settings.setPlaybackPrefix("/hls/");
    settings.setStartupTimeoutMillis(300);
    settings.setReadinessPollMillis(10);
    settings.setStopTimeoutMillis(500);
    launcher = new StubEncoderLauncher();
    listening = true;
    listener = mock(RecorderListener.class);
  }

  private HlsRecorder newRecorder(String streamKey) {
    EncoderReadinessProbe probe = new EncoderReadinessProbe() {
      @Override
      public boolean isListening(String address, int port) {
        return listening;
      }
    };
    return new HlsRecorder(streamKey, engine, registry, settings, launcher, probe, listener);
  }

  private String addVideoProducer(String clientId, String producerId) {
    registry.register(clientId);
    registry.upsertProducer(clientId, new ProducerRecord(producerId, MediaKind.VIDEO, clientId));
    return producerId;
  }

  private static void await(BooleanSupplier condition) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (!condition.getAsBoolean()) {
      if (System.nanoTime() > deadline) {
        throw new AssertionError("condition not met in time");
      }
      Thread.sleep(10);
    }
  }

  @Test
  public void startConnectsTapOnlyAfterEncoderIsListening() throws Exception {
    addVideoProducer("a", "p1");
    HlsRecorder recorder = newRecorder("live");

    recorder.start();

    assertEquals(RecorderState.CONNECTED, recorder.getState());
    assertTrue(recorder.isActive());
    assertEquals("p1", recorder.getSourceProducerId());
    assertEquals("/hls/live/playlist.m3u8", recorder.getPlaylistUrl());
    assertEquals(1, engine.taps.size());
    assertEquals(1, engine.connectedTaps.size());
    assertEquals(1, engine.resumedConsumers.size());

    Path sdp = hlsRoot.resolve("live").resolve(RecordingSettings.INPUT_SDP_NAME);
    assertTrue(Files.exists(sdp));
    String tapSdp = engine.taps.values().iterator().next().getSessionDescription();
    assertEquals(tapSdp, new String(Files.readAllBytes(sdp), StandardCharsets.UTF_8));
    assertTrue(launcher.commands.get(0).contains(sdp.toString()));

    recorder.stop();
  }

  @Test
  public void firstProgressLineMovesToRecording() throws Exception {
    addVideoProducer("a", "p1");
    final HlsRecorder recorder = newRecorder("live");
    recorder.start();

    launcher.last().emit("Input #0, sdp, from 'input.sdp':");
    launcher.last().emit("frame=   12 fps= 30 q=20.0 size=N/A time=00:00:00.40 bitrate=N/A");

    await(() -> recorder.getState() == RecorderState.RECORDING);
    assertTrue(recorder.isActive());
    recorder.stop();
  }

  @Test
  public void stopReleasesEverythingOnce() throws Exception {
    addVideoProducer("a", "p1");
    HlsRecorder recorder = newRecorder("live");
    recorder.start();
    FakeEncoderProcess process = launcher.last();

    recorder.stop();
    recorder.stop();

    assertEquals(RecorderState.STOPPED, recorder.getState());
    assertFalse(recorder.isActive());
    assertTrue(process.isDestroyed());
    assertEquals(1, engine.closedTaps.size());
    assertEquals(1, engine.closedConsumers.size());
    assertTrue(engine.taps.isEmpty());
    verify(listener, never()).onRecorderStopped(eq(recorder), anyString());
  }

  @Test
  public void failsWithoutVideoProducer() {
    registry.register("a");
    registry.upsertProducer("a", new ProducerRecord("p-audio", MediaKind.AUDIO, "a"));
    HlsRecorder recorder = newRecorder("live");

    RelayException e = assertThrows(RelayException.class, recorder::start);

    assertEquals(Code.RECORDER_START_FAILED_ERROR_CODE, e.getCode());
    assertEquals(RecorderState.STOPPED, recorder.getState());
    assertTrue(engine.taps.isEmpty());
    assertTrue(launcher.commands.isEmpty());
  }

  @Test
  public void encoderExitingAtLaunchReleasesTheTap() {
    addVideoProducer("a", "p1");
    launcher.exitImmediately = true;
    listening = false;
    HlsRecorder recorder = newRecorder("live");

    RelayException e = assertThrows(RelayException.class, recorder::start);

    assertEquals(Code.RECORDER_START_FAILED_ERROR_CODE, e.getCode());
    assertEquals(RecorderState.STOPPED, recorder.getState());
    assertTrue(engine.taps.isEmpty());
    assertEquals(1, engine.closedTaps.size());
    assertEquals(1, engine.closedConsumers.size());
    assertTrue(engine.connectedTaps.isEmpty());
    assertTrue(engine.resumedConsumers.isEmpty());
  }

  @Test
  public void encoderNeverListeningTimesOut() {
    addVideoProducer("a", "p1");
    listening = false;
    HlsRecorder recorder = newRecorder("live");

    RelayException e = assertThrows(RelayException.class, recorder::start);

    assertEquals(Code.RECORDER_START_FAILED_ERROR_CODE, e.getCode());
    assertTrue(launcher.last().isDestroyed());
    assertTrue(engine.taps.isEmpty());
    assertTrue(engine.connectedTaps.isEmpty());
  }

  @Test
  public void launchFailureIsReported() {
    addVideoProducer("a", "p1");
    launcher.failure = new IOException("ffmpeg: not found");
    HlsRecorder recorder = newRecorder("live");

    RelayException e = assertThrows(RelayException.class, recorder::start);

    assertEquals(Code.RECORDER_START_FAILED_ERROR_CODE, e.getCode());
    assertTrue(e.getMessage().contains("ffmpeg: not found"));
    assertTrue(engine.taps.isEmpty());
  }

  @Test
  public void tapConnectFailureStopsTheEncoder() {
    addVideoProducer("a", "p1");
    engine.failConnectTap = true;
    HlsRecorder recorder = newRecorder("live");

    RelayException e = assertThrows(RelayException.class, recorder::start);

    assertEquals(Code.RECORDER_START_FAILED_ERROR_CODE, e.getCode());
    assertTrue(launcher.last().isDestroyed());
    assertTrue(engine.taps.isEmpty());
  }

  @Test
  public void encoderExitWhileConnectingTapFailsStart() {
    addVideoProducer("a", "p1");
    engine = new FakeMediaEngine() {
      @Override
      public void connectTap(TapHandle tap) {
        super.connectTap(tap);
        launcher.last().exit(1);
      }
    };
    HlsRecorder recorder = newRecorder("live");

    RelayException e = assertThrows(RelayException.class, recorder::start);

    assertEquals(Code.RECORDER_START_FAILED_ERROR_CODE, e.getCode());
    assertEquals(RecorderState.STOPPED, recorder.getState());
    assertFalse(recorder.isActive());
    assertTrue(engine.taps.isEmpty());
    assertEquals(1, engine.closedTaps.size());
    assertEquals(1, engine.closedConsumers.size());
    verify(listener, never()).onRecorderStopped(eq(recorder), anyString());
  }

  @Test
  public void encoderCrashWhileRecordingNotifiesListener() throws Exception {
    addVideoProducer("a", "p1");
    HlsRecorder recorder = newRecorder("live");
    recorder.start();

    launcher.last().exit(1);

    verify(listener, timeout(5000)).onRecorderStopped(eq(recorder), anyString());
    assertEquals(RecorderState.STOPPED, recorder.getState());
    assertTrue(engine.taps.isEmpty());
  }

  @Test
  public void restartedRecorderIsNotReused() throws Exception {
    addVideoProducer("a", "p1");
    HlsRecorder recorder = newRecorder("live");
    recorder.start();
    recorder.stop();

    assertThrows(RelayException.class, recorder::start);
    assertEquals(1, launcher.processes.size());
  }

  @Test
  public void checkFilesReportsPlaylistAndSegments() throws Exception {
    HlsRecorder recorder = newRecorder("files");
    Path dir = hlsRoot.resolve("files");
    Files.createDirectories(dir);

    assertFalse(recorder.checkFiles().isPlaylistExists());

    Files.write(dir.resolve(RecordingSettings.PLAYLIST_NAME), new byte[] { '#' });
    Files.write(dir.resolve("segment_1700000000.ts"), new byte[] { 0 });

    HlsRecorder.FileStatus status = recorder.checkFiles();
    assertTrue(status.isPlaylistExists());
    assertTrue(status.isHasSegments());
  }
}
