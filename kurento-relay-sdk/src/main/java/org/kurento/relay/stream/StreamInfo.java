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

import java.util.Collections;
import java.util.List;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

/**
 * Immutable view of a broadcast group, as announced to clients.
 */
public class StreamInfo {
  private final String streamKey;
  private final String playlistUrl;
  private final List<String> members;
  private final StreamState state;

  public StreamInfo(String streamKey, String playlistUrl, List<String> members, StreamState state) {
    this.streamKey = streamKey;
    this.playlistUrl = playlistUrl;
    this.members = Collections.unmodifiableList(members);
    this.state = state;
  }

  public String getStreamKey() {
    return streamKey;
  }

  /**
   * @return the playback locator, or null while no recorder is attached
   */
  public String getPlaylistUrl() {
    return playlistUrl;
  }

  public List<String> getMembers() {
    return members;
  }

  public StreamState getState() {
    return state;
  }

  public boolean isLive() {
    return state == StreamState.RECORDING;
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    json.addProperty("streamId", streamKey);
    if (playlistUrl != null) {
      json.addProperty("playlistUrl", playlistUrl);
    }
    JsonArray streamers = new JsonArray();
    for (String member : members) {
      streamers.add(member);
    }
    json.add("streamers", streamers);
    json.addProperty("isLive", isLive());
    return json;
  }

  @Override
  public String toString() {
    return "[Stream " + streamKey + " " + state + " members=" + members + "]";
  }
}
