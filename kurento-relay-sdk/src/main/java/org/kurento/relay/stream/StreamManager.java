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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;

import javax.annotation.PreDestroy;

import org.kurento.relay.api.RelayNotifier;
import org.kurento.relay.api.pojo.MediaKind;
import org.kurento.relay.exception.RelayException;
import org.kurento.relay.exception.RelayException.Code;
import org.kurento.relay.internal.ProtocolElements;
import org.kurento.relay.recording.HlsRecorder;
import org.kurento.relay.recording.HlsRecorderFactory;
import org.kurento.relay.recording.RecorderListener;
import org.kurento.relay.registry.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonObject;

/**
 * Tracks the broadcast groups and decides when their recorders start and stop.
 * <p/>
 * Every change to a group, recorder attachment included, happens while holding the group instance
 * as monitor. A group removed from the table is flagged so that callers which obtained the stale
 * instance retry against the table.
 * <p/>
 * Replacing a recorder that went away starts a new encoder, so it runs on the worker executor
 * instead of inside the call that reported the loss.
 */
public class StreamManager implements RecorderListener {
  private static final Logger log = LoggerFactory.getLogger(StreamManager.class);

  private static final String GENERATED_KEY_PREFIX = "stream_";

  private final ConcurrentMap<String, StreamGroup> groups =
      new ConcurrentHashMap<String, StreamGroup>();

  private final SessionRegistry registry;
  private final HlsRecorderFactory recorderFactory;
  private final RelayNotifier notifier;
  private final Executor workers;

  private volatile boolean closed = false;

  public StreamManager(SessionRegistry registry, HlsRecorderFactory recorderFactory,
      RelayNotifier notifier) {
    this(registry, recorderFactory, notifier, Runnable::run);
  }

  public StreamManager(SessionRegistry registry, HlsRecorderFactory recorderFactory,
      RelayNotifier notifier, Executor workers) {
    this.registry = registry;
    this.recorderFactory = recorderFactory;
    this.notifier = notifier;
    this.workers = workers;
  }

  /**
   * Adds the client to the group named by the key, creating the group if needed, and attaches a
   * recorder when a video producer is available and none is attached yet.
   *
   * @param clientId     the requesting client
   * @param requestedKey the stream key, or null to have one generated
   * @return the group after the operation
   * @throws RelayException RECORDER_START_FAILED if the recorder could not be started; the group
   *                        and its membership are kept
   */
  public StreamInfo startBroadcast(String clientId, String requestedKey) throws RelayException {
    checkClosed();
    String streamKey = resolveKey(requestedKey);
    while (true) {
      StreamGroup group = groups.get(streamKey);
      if (group == null) {
        StreamGroup newGroup = new StreamGroup(streamKey);
        group = groups.putIfAbsent(streamKey, newGroup);
        if (group == null) {
          group = newGroup;
          log.info("STREAM {}: Created broadcast group", streamKey);
        }
      }
      synchronized (group) {
        if (group.isRemoved()) {
          continue;
        }
        if (group.addMember(clientId)) {
          log.debug("STREAM {}: Client {} joined the broadcast", streamKey, clientId);
        }
        if (group.getRecorder() == null && hasVideoProducers()) {
          attachRecorder(group);
        } else if (group.getRecorder() != null) {
          log.debug("STREAM {}: Already recording, start request ignored", streamKey);
        }
        return group.toInfo();
      }
    }
  }

  /**
   * Removes the client from the group. The group is deleted as soon as its last member leaves,
   * whether or not a recorder was attached; an attached recorder is stopped and streamEnded is
   * broadcast, a group that never went live disappears without any notification. Stopping a group
   * the client does not belong to changes nothing.
   *
   * @throws RelayException NOT_FOUND if no group exists for the key
   */
  public void stopBroadcast(String clientId, String streamKey) throws RelayException {
    if (streamKey == null) {
      throw new RelayException(Code.INVALID_REQUEST_ERROR_CODE, "Missing stream key");
    }
    StreamGroup group = groups.get(streamKey);
    if (group == null) {
      throw new RelayException(Code.NOT_FOUND_ERROR_CODE, "No active stream '" + streamKey + "'");
    }
    synchronized (group) {
      if (group.isRemoved()) {
        throw new RelayException(Code.NOT_FOUND_ERROR_CODE,
            "No active stream '" + streamKey + "'");
      }
      leave(group, clientId);
    }
  }

  /**
   * Implicit stop of every group the client belongs to.
   */
  public void removeClient(String clientId) {
    for (StreamGroup group : new ArrayList<StreamGroup>(groups.values())) {
      synchronized (group) {
        if (!group.isRemoved() && group.hasMember(clientId)) {
          leave(group, clientId);
        }
      }
    }
  }

  /**
   * Attaches a recorder to every group that is waiting for a video source.
   */
  public void onVideoProducerAvailable(String producerId) {
    for (StreamGroup group : new ArrayList<StreamGroup>(groups.values())) {
      synchronized (group) {
        if (group.isRemoved() || group.getRecorder() != null || group.isEmpty()) {
          continue;
        }
        log.debug("STREAM {}: Video producer {} available, attaching recorder",
            group.getStreamKey(), producerId);
        try {
          attachRecorder(group);
        } catch (RelayException e) {
          log.warn("STREAM {}: Unable to attach recorder to producer {}: {}",
              group.getStreamKey(), producerId, e.getMessage());
        }
      }
    }
  }

  /**
   * Detaches the recorders fed by a producer that has gone away and retries with another video
   * source.
   */
  public void onProducerClosed(String producerId) {
    List<StreamGroup> orphaned = new ArrayList<StreamGroup>();
    for (StreamGroup group : new ArrayList<StreamGroup>(groups.values())) {
      synchronized (group) {
        HlsRecorder recorder = group.getRecorder();
        if (group.isRemoved() || recorder == null
            || !producerId.equals(recorder.getSourceProducerId())) {
          continue;
        }
        log.info("STREAM {}: Source producer {} closed", group.getStreamKey(), producerId);
        boolean wasLive = recorder.isActive();
        group.detachRecorder();
        recorder.stop();
        if (wasLive) {
          notifyStreamEnded(group.getStreamKey());
        }
        orphaned.add(group);
      }
    }
    for (StreamGroup group : orphaned) {
      scheduleReattach(group);
    }
  }

  @Override
  public void onRecorderStopped(HlsRecorder recorder, String reason) {
    StreamGroup group = groups.get(recorder.getStreamKey());
    if (group == null) {
      return;
    }
    synchronized (group) {
      if (group.isRemoved() || group.getRecorder() != recorder) {
        log.debug("STREAM {}: Ignoring stop of a detached recorder", recorder.getStreamKey());
        return;
      }
      log.warn("STREAM {}: Recorder stopped unexpectedly: {}", group.getStreamKey(), reason);
      group.detachRecorder();
      notifyStreamEnded(group.getStreamKey());
    }
    scheduleReattach(group);
  }

  public List<StreamInfo> listStreams() {
    List<StreamInfo> streams = new ArrayList<StreamInfo>();
    for (StreamGroup group : groups.values()) {
      synchronized (group) {
        if (!group.isRemoved()) {
          streams.add(group.toInfo());
        }
      }
    }
    return streams;
  }

  /**
   * @return the group for the key, or null if absent
   */
  public StreamInfo getStream(String streamKey) {
    StreamGroup group = groups.get(streamKey);
    if (group == null) {
      return null;
    }
    synchronized (group) {
      return group.isRemoved() ? null : group.toInfo();
    }
  }

  /**
   * Stops every recorder and forgets every group.
   */
  @PreDestroy
  public void close() {
    closed = true;
    for (StreamGroup group : new ArrayList<StreamGroup>(groups.values())) {
      synchronized (group) {
        if (group.isRemoved()) {
          continue;
        }
        remove(group);
        HlsRecorder recorder = group.detachRecorder();
        if (recorder != null) {
          recorder.stop();
        }
      }
    }
    log.info("Stream manager closed");
  }

  private void leave(StreamGroup group, String clientId) {
    if (!group.removeMember(clientId)) {
      log.debug("STREAM {}: Client {} is not a member", group.getStreamKey(), clientId);
      return;
    }
    log.debug("STREAM {}: Client {} left the broadcast", group.getStreamKey(), clientId);
    if (!group.isEmpty()) {
      return;
    }
    remove(group);
    HlsRecorder recorder = group.detachRecorder();
    if (recorder != null) {
      recorder.stop();
      notifyStreamEnded(group.getStreamKey());
    }
    log.info("STREAM {}: Last member left, group removed", group.getStreamKey());
  }

  private void attachRecorder(StreamGroup group) throws RelayException {
    HlsRecorder recorder = recorderFactory.create(group.getStreamKey(), this);
    recorder.start();
    group.setRecorder(recorder);
    StreamInfo info = group.toInfo();
    log.info("STREAM {}: Live at {} with source {}", group.getStreamKey(),
        info.getPlaylistUrl(), recorder.getSourceProducerId());
    notifyStreamLive(info);
  }

  private void scheduleReattach(final StreamGroup group) {
    if (closed) {
      return;
    }
    workers.execute(new Runnable() {
      @Override
      public void run() {
        retryAttach(group);
      }
    });
  }

  private void retryAttach(StreamGroup group) {
    synchronized (group) {
      if (group.isRemoved() || group.getRecorder() != null || group.isEmpty() || closed
          || !hasVideoProducers()) {
        return;
      }
      try {
        attachRecorder(group);
      } catch (RelayException e) {
        log.warn("STREAM {}: Unable to reattach a recorder: {}", group.getStreamKey(),
            e.getMessage());
      }
    }
  }

  private void remove(StreamGroup group) {
    group.markRemoved();
    groups.remove(group.getStreamKey(), group);
  }

  private boolean hasVideoProducers() {
    return !registry.findProducers(MediaKind.VIDEO).isEmpty();
  }

  private void notifyStreamLive(StreamInfo info) {
    JsonObject params = info.toJson();
    params.remove("isLive");
    notifier.broadcast(ProtocolElements.STREAMLIVE_METHOD, params);
  }

  private void notifyStreamEnded(String streamKey) {
    JsonObject params = new JsonObject();
    params.addProperty(ProtocolElements.HLSSTREAM_STREAMID_PARAM, streamKey);
    notifier.broadcast(ProtocolElements.STREAMENDED_METHOD, params);
  }

  private void checkClosed() {
    if (closed) {
      throw new RelayException(Code.ENGINE_UNAVAILABLE_ERROR_CODE, "Stream manager is closed");
    }
  }

  static String resolveKey(String requestedKey) {
    if (requestedKey == null || requestedKey.trim().isEmpty()) {
      return GENERATED_KEY_PREFIX + System.currentTimeMillis();
    }
    String key = requestedKey.trim().replaceAll("[^A-Za-z0-9_-]", "_");
    if (key.replace("_", "").isEmpty()) {
      throw new RelayException(Code.INVALID_REQUEST_ERROR_CODE,
          "Invalid stream key '" + requestedKey + "'");
    }
    return key;
  }
}
