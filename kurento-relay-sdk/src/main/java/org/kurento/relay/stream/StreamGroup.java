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
import java.util.LinkedHashSet;
import java.util.Set;

import org.kurento.relay.recording.HlsRecorder;

/**
 * A named broadcast group: its member clients and the recorder attached to it, if any.
 * <p/>
 * Not thread-safe on its own. The {@link StreamManager} uses each group instance as the monitor of
 * its stream key; once {@link #markRemoved()} has been called the instance is no longer in the
 * table and must not be reused.
 */
public class StreamGroup {

  private final String streamKey;
  private final Set<String> members = new LinkedHashSet<String>();
  private HlsRecorder recorder;
  private boolean removed = false;

  public StreamGroup(String streamKey) {
    this.streamKey = streamKey;
  }

  public String getStreamKey() {
    return streamKey;
  }

  public boolean addMember(String clientId) {
    return members.add(clientId);
  }

  public boolean removeMember(String clientId) {
    return members.remove(clientId);
  }

  public boolean hasMember(String clientId) {
    return members.contains(clientId);
  }

  public boolean isEmpty() {
    return members.isEmpty();
  }

  public HlsRecorder getRecorder() {
    return recorder;
  }

  public void setRecorder(HlsRecorder recorder) {
    this.recorder = recorder;
  }

  public HlsRecorder detachRecorder() {
    HlsRecorder detached = recorder;
    recorder = null;
    return detached;
  }

  public StreamState getState() {
    return recorder != null && recorder.isActive() ? StreamState.RECORDING : StreamState.ACTIVE;
  }

  public boolean isRemoved() {
    return removed;
  }

  void markRemoved() {
    this.removed = true;
  }

  public StreamInfo toInfo() {
    return new StreamInfo(streamKey, recorder != null ? recorder.getPlaylistUrl() : null,
        new ArrayList<String>(members), getState());
  }
}
