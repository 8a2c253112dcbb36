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

import com.google.gson.JsonObject;

/**
 * Engine-side consumer. Consumers are always created paused and start receiving media once
 * resumed.
 */
public class ConsumerHandle {
  private final String id;
  private final String producerId;
  private final MediaKind kind;
  private final JsonObject rtpParameters;

  public ConsumerHandle(String id, String producerId, MediaKind kind, JsonObject rtpParameters) {
    this.id = id;
    this.producerId = producerId;
    this.kind = kind;
    this.rtpParameters = rtpParameters != null ? rtpParameters : new JsonObject();
  }

  public String getId() {
    return id;
  }

  public String getProducerId() {
    return producerId;
  }

  public MediaKind getKind() {
    return kind;
  }

  public JsonObject getRtpParameters() {
    return rtpParameters.deepCopy();
  }

  @Override
  public String toString() {
    return "ConsumerHandle{id='" + id + "', producerId='" + producerId + "', kind=" + kind + '}';
  }
}
