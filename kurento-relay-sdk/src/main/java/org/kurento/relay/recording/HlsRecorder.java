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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.kurento.relay.api.MediaEngine;
import org.kurento.relay.api.pojo.ConsumerHandle;
import org.kurento.relay.api.pojo.MediaKind;
import org.kurento.relay.api.pojo.TapHandle;
import org.kurento.relay.exception.RelayException;
import org.kurento.relay.exception.RelayException.Code;
import org.kurento.relay.registry.ProducerRecord;
import org.kurento.relay.registry.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bridges one live video producer into an HLS playlist. The recorder owns a passive tap
 * transport, a tap consumer and an ffmpeg process, and releases the three together.
 * <p/>
 * Startup order: the tap consumer is created paused, the encoder is launched and the recorder
 * waits until the encoder has bound its input port (bounded by the startup timeout). Only then
 * is the tap connected and the consumer resumed. Any failure along the way stops the recorder
 * and is reported as {@link Code#RECORDER_START_FAILED_ERROR_CODE}.
 */
public class HlsRecorder {
  private static final Logger log = LoggerFactory.getLogger(HlsRecorder.class);

  private final String streamKey;
  private final MediaEngine engine;
  private final SessionRegistry registry;
  private final RecordingSettings settings;
  private final EncoderLauncher launcher;
  private final EncoderReadinessProbe readinessProbe;
  private final RecorderListener listener;
  private final Path outputDir;

  private volatile RecorderState state = RecorderState.IDLE;

  private volatile String sourceProducerId;
  private TapHandle tap;
  private ConsumerHandle tapConsumer;
  private Process encoder;
  private Integer startupExitCode;

  public HlsRecorder(String streamKey, MediaEngine engine, SessionRegistry registry,
      RecordingSettings settings, EncoderLauncher launcher, EncoderReadinessProbe readinessProbe,
      RecorderListener listener) {
    this.streamKey = streamKey;
    this.engine = engine;
    this.registry = registry;
    this.settings = settings;
    this.launcher = launcher;
    this.readinessProbe = readinessProbe;
    this.listener = listener;
    this.outputDir = settings.getOutputDirectory(streamKey);
  }

  public String getStreamKey() {
    return streamKey;
  }

  public RecorderState getState() {
    return state;
  }

  public boolean isActive() {
    return state.isActive();
  }

  public String getSourceProducerId() {
    return sourceProducerId;
  }

  public Path getOutputDirectory() {
    return outputDir;
  }

  public String getPlaylistUrl() {
    return settings.getPlaylistUrl(streamKey);
  }

  /**
   * Snapshot of the files the encoder has produced so far.
   */
  public FileStatus checkFiles() {
    Path playlist = outputDir.resolve(RecordingSettings.PLAYLIST_NAME);
    Path firstSegment = outputDir.resolve(String.format(RecordingSettings.SEGMENT_PATTERN, 0));
    boolean hasSegments = Files.exists(firstSegment);
    if (!hasSegments && Files.isDirectory(outputDir)) {
      try (DirectoryStream<Path> segments = Files.newDirectoryStream(outputDir, "*.ts")) {
        hasSegments = segments.iterator().hasNext();
      } catch (IOException e) {
        log.debug("RECORDER {}: Unable to list {}: {}", streamKey, outputDir, e.getMessage());
      }
    }
    return new FileStatus(Files.exists(playlist), hasSegments, playlist);
  }

  /**
   * Starts recording the first video producer found in the registry. Blocks until the pipeline is
   * connected or has failed.
   *
   * @throws RelayException RECORDER_START_FAILED if no video producer exists or any step fails;
   *                        the recorder is then {@link RecorderState#STOPPED}
   */
  public void start() throws RelayException {
    synchronized (this) {
      if (state != RecorderState.IDLE) {
        if (state.isActive()) {
          log.warn("RECORDER {}: Already recording", streamKey);
          return;
        }
        throw new RelayException(Code.RECORDER_START_FAILED_ERROR_CODE,
            "Recorder for '" + streamKey + "' cannot be started from state " + state);
      }
    }

    List<ProducerRecord> videoProducers = registry.findProducers(MediaKind.VIDEO);
    if (videoProducers.isEmpty()) {
      state = RecorderState.STOPPED;
      throw new RelayException(Code.RECORDER_START_FAILED_ERROR_CODE, "No video producers found");
    }
    sourceProducerId = videoProducers.get(0).getProducerId();
    log.info("RECORDER {}: Starting recording for producer {}", streamKey, sourceProducerId);

    try {
      TapHandle newTap = engine.openPassiveTap(settings.getTapAddress());
      synchronized (this) {
        tap = newTap;
      }
      ConsumerHandle newConsumer = engine.tapConsume(newTap, sourceProducerId);
      synchronized (this) {
        tapConsumer = newConsumer;
      }
      transition(RecorderState.IDLE, RecorderState.TAP_CREATED);
      log.debug("RECORDER {}: Tap {} listening for encoder on {}:{}", streamKey, newTap.getId(),
          newTap.getAddress(), newTap.getLocalPort());

      Files.createDirectories(outputDir);
      Path sdpFile = outputDir.resolve(RecordingSettings.INPUT_SDP_NAME);
      Files.write(sdpFile, newTap.getSessionDescription().getBytes(StandardCharsets.UTF_8));

      Process process = launcher.launch(FfmpegCommand.build(settings, sdpFile, outputDir),
          outputDir);
      synchronized (this) {
        encoder = process;
      }
      transition(RecorderState.TAP_CREATED, RecorderState.AWAITING_ENCODER);
      followEncoderOutput(process);

      awaitEncoderReady(process, newTap);

      engine.connectTap(newTap);
      engine.resumeConsumer(newConsumer.getId());
      markConnected(process);
      log.info("RECORDER {}: HLS recording pipeline established, playlist at {}", streamKey,
          getPlaylistUrl());
    } catch (RelayException e) {
      log.warn("RECORDER {}: Error starting HLS recording: {}", streamKey, e.getMessage());
      stop();
      if (e.getCode() == Code.RECORDER_START_FAILED_ERROR_CODE) {
        throw e;
      }
      throw new RelayException(Code.RECORDER_START_FAILED_ERROR_CODE,
          "Failed to start HLS recording for '" + streamKey + "': " + e.getMessage(), e);
    } catch (IOException e) {
      log.warn("RECORDER {}: Error starting HLS recording", streamKey, e);
      stop();
      throw new RelayException(Code.RECORDER_START_FAILED_ERROR_CODE,
          "Failed to start HLS recording for '" + streamKey + "': " + e.getMessage(), e);
    }
  }

  /**
   * Releases the tap consumer, the tap transport and the encoder. Calling it again is a no-op.
   */
  public void stop() {
    Process process;
    ConsumerHandle consumer;
    TapHandle tapToClose;
    synchronized (this) {
      if (state == RecorderState.STOPPED && encoder == null && tap == null && tapConsumer == null) {
        log.debug("RECORDER {}: Already stopped", streamKey);
        return;
      }
      state = RecorderState.STOPPED;
      process = encoder;
      consumer = tapConsumer;
      tapToClose = tap;
      encoder = null;
      tapConsumer = null;
      tap = null;
    }
    log.info("RECORDER {}: Stopping HLS recording", streamKey);

    if (process != null) {
      terminate(process);
    }
    if (consumer != null) {
      try {
        engine.closeConsumer(consumer.getId());
      } catch (RelayException e) {
        log.warn("RECORDER {}: Could not close tap consumer {}", streamKey, consumer.getId(), e);
      }
    }
    if (tapToClose != null) {
      try {
        engine.closeTap(tapToClose.getId());
      } catch (RelayException e) {
        log.warn("RECORDER {}: Could not close tap transport {}", streamKey, tapToClose.getId(), e);
      }
    }
    log.info("RECORDER {}: HLS recording cleanup completed", streamKey);
  }

  private void awaitEncoderReady(Process process, TapHandle tapHandle) {
    long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(
        settings.getStartupTimeoutMillis());
    while (true) {
      if (state == RecorderState.STOPPED) {
        throw new RelayException(Code.RECORDER_START_FAILED_ERROR_CODE,
            "Recorder for '" + streamKey + "' was stopped during startup");
      }
      if (!process.isAlive()) {
        throw new RelayException(Code.RECORDER_START_FAILED_ERROR_CODE,
            "Encoder exited during startup with code " + process.exitValue());
      }
      if (readinessProbe.isListening(tapHandle.getAddress(), tapHandle.getLocalPort())) {
        break;
      }
      if (System.nanoTime() - deadline > 0) {
        throw new RelayException(Code.RECORDER_START_FAILED_ERROR_CODE,
            "Encoder not listening on " + tapHandle.getAddress() + ":" + tapHandle.getLocalPort()
                + " after " + settings.getStartupTimeoutMillis() + " ms");
      }
      try {
        Thread.sleep(settings.getReadinessPollMillis());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new RelayException(Code.RECORDER_START_FAILED_ERROR_CODE,
            "Interrupted while waiting for the encoder: " + e.getMessage(), e);
      }
    }
    log.debug("RECORDER {}: Encoder listening on port {}", streamKey, tapHandle.getLocalPort());
  }

  private void followEncoderOutput(final Process process) {
    Thread reader = new Thread(new Runnable() {
      @Override
      public void run() {
        try (BufferedReader in = new BufferedReader(
            new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
          String line;
          while ((line = in.readLine()) != null) {
            onEncoderOutput(line);
          }
        } catch (IOException e) {
          log.debug("RECORDER {}: Encoder output closed: {}", streamKey, e.getMessage());
        }
        try {
          int exitCode = process.waitFor();
          onEncoderExit(process, exitCode);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
      }
    }, "hls-encoder-" + streamKey);
    reader.setDaemon(true);
    reader.start();
  }

  void onEncoderOutput(String line) {
    String output = line.trim();
    if (output.isEmpty()) {
      return;
    }
    if (output.contains("frame=") && output.contains("fps=")) {
      synchronized (this) {
        if (state == RecorderState.CONNECTED) {
          state = RecorderState.RECORDING;
          log.info("RECORDER {}: Encoder started processing frames ({})", streamKey, checkFiles());
        }
      }
      log.trace("RECORDER {}: {}", streamKey, output);
    } else if (output.contains("Error") || output.contains("Failed")) {
      log.warn("RECORDER {}: Encoder error: {}", streamKey, output);
    } else {
      log.debug("RECORDER {}: {}", streamKey, output);
    }
  }

  private void onEncoderExit(Process process, int exitCode) {
    boolean unexpected;
    synchronized (this) {
      if (encoder == process && state == RecorderState.AWAITING_ENCODER) {
        startupExitCode = exitCode;
        log.warn("RECORDER {}: Encoder exited with code {} before the tap was connected",
            streamKey, exitCode);
        return;
      }
      unexpected = encoder == process && state.isActive();
    }
    if (!unexpected) {
      log.debug("RECORDER {}: Encoder process closed with code {}", streamKey, exitCode);
      return;
    }
    log.warn("RECORDER {}: Encoder process exited unexpectedly with code {}", streamKey, exitCode);
    stop();
    if (listener != null) {
      listener.onRecorderStopped(this, "Encoder exited with code " + exitCode);
    }
  }

  private void terminate(Process process) {
    if (!process.isAlive()) {
      return;
    }
    process.destroy();
    try {
      if (!process.waitFor(settings.getStopTimeoutMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("RECORDER {}: Encoder did not exit, killing it", streamKey);
        process.destroyForcibly();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      process.destroyForcibly();
    }
  }

  /**
   * Completes startup. An encoder that died while the tap was being connected fails the start
   * instead of leaving a connected recorder without an encoder.
   */
  private synchronized void markConnected(Process process) {
    if (startupExitCode != null || !process.isAlive()) {
      throw new RelayException(Code.RECORDER_START_FAILED_ERROR_CODE,
          "Encoder for '" + streamKey + "' exited during startup"
              + (startupExitCode != null ? " with code " + startupExitCode : ""));
    }
    transition(RecorderState.AWAITING_ENCODER, RecorderState.CONNECTED);
  }

  private synchronized void transition(RecorderState from, RecorderState to) {
    if (state != from) {
      throw new RelayException(Code.RECORDER_START_FAILED_ERROR_CODE,
          "Recorder for '" + streamKey + "' left state " + from + " during startup (now " + state
              + ")");
    }
    state = to;
    log.debug("RECORDER {}: {} -> {}", streamKey, from, to);
  }

  public static class FileStatus {
    private final boolean playlistExists;
    private final boolean hasSegments;
    private final Path playlistPath;

    public FileStatus(boolean playlistExists, boolean hasSegments, Path playlistPath) {
      this.playlistExists = playlistExists;
      this.hasSegments = hasSegments;
      this.playlistPath = playlistPath;
    }

    public boolean isPlaylistExists() {
      return playlistExists;
    }

    public boolean isHasSegments() {
      return hasSegments;
    }

    public Path getPlaylistPath() {
      return playlistPath;
    }

    @Override
    public String toString() {
      return "playlist=" + playlistExists + ", segments=" + hasSegments + ", path=" + playlistPath;
    }
  }

  @Override
  public String toString() {
    return "[Recorder " + streamKey + " " + state + "]";
  }
}
