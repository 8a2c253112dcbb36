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

/**
 * Passive (plain RTP) tap transport used to hand media to a local encoder process.
 * <p/>
 * {@code localPort} is the UDP port on {@code address} where the encoder must listen, and
 * {@code sessionDescription} is the SDP the encoder reads to decode the incoming RTP.
 */
public class TapHandle {
  private final String id;
  private final String address;
  private final int localPort;
  private final String sessionDescription;

  public TapHandle(String id, String address, int localPort, String sessionDescription) {
    this.id = id;
    this.address = address;
    this.localPort = localPort;
    this.sessionDescription = sessionDescription;
  }

  public String getId() {
    return id;
  }

  public String getAddress() {
    return address;
  }

  public int getLocalPort() {
    return localPort;
  }

  public String getSessionDescription() {
    return sessionDescription;
  }

  @Override
  public String toString() {
    return "TapHandle{id='" + id + "', address='" + address + "', localPort=" + localPort + '}';
  }
}
