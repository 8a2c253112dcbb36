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
package org.kurento.relay.api.pojo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.kurento.relay.exception.RelayException;
import org.kurento.relay.exception.RelayException.Code;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

/**
 * Codec capabilities, either the ones offered by the engine or the receive capabilities declared
 * by a client. Serialized as {@code {"codecs": [...]}}.
 */
public class RtpCapabilities {
  private static final Gson gson = new Gson();

  private List<CodecCapability> codecs = new ArrayList<CodecCapability>();

  public RtpCapabilities() {
  }

  public RtpCapabilities(List<CodecCapability> codecs) {
    this.codecs = new ArrayList<CodecCapability>(codecs);
  }

  public List<CodecCapability> getCodecs() {
    return codecs != null ? Collections.unmodifiableList(codecs)
        : Collections.<CodecCapability>emptyList();
  }

  /**
   * Returns true if this object declares at least one codec of the given kind that is also
   * offered by the engine.
   *
   * @param kind      media kind of the producer to receive
   * @param offered   capabilities of the engine
   */
  public boolean canReceive(MediaKind kind, RtpCapabilities offered) {
    for (CodecCapability mine : getCodecs()) {
      if (mine.getKind() != kind) {
        continue;
      }
      for (CodecCapability theirs : offered.getCodecs()) {
        if (mine.matches(theirs)) {
          return true;
        }
      }
    }
    return false;
  }

  public JsonObject toJson() {
    return gson.toJsonTree(this).getAsJsonObject();
  }

  public static RtpCapabilities fromJson(JsonObject json) {
    if (json == null) {
      throw new RelayException(Code.INVALID_REQUEST_ERROR_CODE, "Capabilities object is required");
    }
    try {
      RtpCapabilities caps = gson.fromJson(json, RtpCapabilities.class);
      for (CodecCapability codec : caps.getCodecs()) {
        codec.getKind();
      }
      return caps;
    } catch (JsonParseException e) {
      throw new RelayException(Code.INVALID_REQUEST_ERROR_CODE,
          "Malformed capabilities object: " + e.getMessage(), e);
    }
  }

  @Override
  public String toString() {
    return "RtpCapabilities" + getCodecs();
  }
}
