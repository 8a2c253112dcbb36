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

import java.util.Objects;

import com.google.gson.JsonObject;

/**
 * Single codec entry of a capabilities object.
 */
public class CodecCapability {
  private String kind;
  private String mimeType;
  private int clockRate;
  private Integer channels;
  private JsonObject parameters;

  public CodecCapability() {
  }

  public CodecCapability(MediaKind kind, String mimeType, int clockRate, Integer channels) {
    this.kind = kind.getValue();
    this.mimeType = mimeType;
    this.clockRate = clockRate;
    this.channels = channels;
  }

  public MediaKind getKind() {
    return kind != null ? MediaKind.fromValue(kind) : null;
  }

  public String getMimeType() {
    return mimeType;
  }

  public int getClockRate() {
    return clockRate;
  }

  public Integer getChannels() {
    return channels;
  }

  public JsonObject getParameters() {
    return parameters;
  }

  public void setParameters(JsonObject parameters) {
    this.parameters = parameters;
  }

  /**
   * Two codecs match when kind, mime type (case insensitive) and clock rate agree. Format
   * parameters are not compared.
   */
  public boolean matches(CodecCapability other) {
    if (other == null || mimeType == null || other.mimeType == null) {
      return false;
    }
    return Objects.equals(kind, other.kind) && mimeType.equalsIgnoreCase(other.mimeType)
        && clockRate == other.clockRate;
  }

  @Override
  public String toString() {
    return "CodecCapability{kind='" + kind + "', mimeType='" + mimeType + "', clockRate="
        + clockRate + ", channels=" + channels + '}';
  }
}
