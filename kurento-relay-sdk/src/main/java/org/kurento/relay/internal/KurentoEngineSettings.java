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

import java.util.ArrayList;
import java.util.List;

import org.kurento.relay.api.pojo.CodecCapability;
import org.kurento.relay.api.pojo.MediaKind;

/**
 * Settings of the Kurento binding of the media engine.
 */
public class KurentoEngineSettings {

  private List<CodecCapability> codecs = defaultCodecs();
  private int rtpMinPort = 40000;
  private int rtpMaxPort = 40999;
  private int tapPayloadType = 96;
  private String tapCodec = "H264/90000";

  public static List<CodecCapability> defaultCodecs() {
    List<CodecCapability> codecs = new ArrayList<CodecCapability>();
    codecs.add(new CodecCapability(MediaKind.AUDIO, "audio/opus", 48000, 2));
    codecs.add(new CodecCapability(MediaKind.VIDEO, "video/H264", 90000, null));
    return codecs;
  }

  public List<CodecCapability> getCodecs() {
    return codecs;
  }

  public void setCodecs(List<CodecCapability> codecs) {
    this.codecs = codecs;
  }

  public int getRtpMinPort() {
    return rtpMinPort;
  }

  public void setRtpMinPort(int rtpMinPort) {
    this.rtpMinPort = rtpMinPort;
  }

  public int getRtpMaxPort() {
    return rtpMaxPort;
  }

  public void setRtpMaxPort(int rtpMaxPort) {
    this.rtpMaxPort = rtpMaxPort;
  }

  public int getTapPayloadType() {
    return tapPayloadType;
  }

  public void setTapPayloadType(int tapPayloadType) {
    this.tapPayloadType = tapPayloadType;
  }

  /**
   * @return the encoding name and clock rate of the tap video, as found in an rtpmap attribute
   */
  public String getTapCodec() {
    return tapCodec;
  }

  public void setTapCodec(String tapCodec) {
    this.tapCodec = tapCodec;
  }
}
