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
 * Engine-side producer: a client's outbound media stream.
 */
public class ProducerHandle {
  private final String id;
  private final MediaKind kind;
  private final String transportId;

  public ProducerHandle(String id, MediaKind kind, String transportId) {
    this.id = id;
    this.kind = kind;
    this.transportId = transportId;
  }

  public String getId() {
    return id;
  }

  public MediaKind getKind() {
    return kind;
  }

  public String getTransportId() {
    return transportId;
  }

  @Override
  public String toString() {
    return "ProducerHandle{id='" + id + "', kind=" + kind + ", transportId='" + transportId + "'}";
  }
}
