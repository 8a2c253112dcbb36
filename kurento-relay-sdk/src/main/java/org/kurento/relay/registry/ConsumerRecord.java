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
package org.kurento.relay.registry;

import org.kurento.relay.api.pojo.MediaKind;

/**
 * Inbound consumer requested by a client, keyed by its own id inside the client session.
 */
public class ConsumerRecord {
  private final String consumerId;
  private final String producerId;
  private final String clientId;
  private final MediaKind kind;
  private volatile boolean paused = true;

  public ConsumerRecord(String consumerId, String producerId, String clientId, MediaKind kind) {
    this.consumerId = consumerId;
    this.producerId = producerId;
    this.clientId = clientId;
    this.kind = kind;
  }

  public String getConsumerId() {
    return consumerId;
  }

  public String getProducerId() {
    return producerId;
  }

  public String getClientId() {
    return clientId;
  }

  public MediaKind getKind() {
    return kind;
  }

  public boolean isPaused() {
    return paused;
  }

  public void setPaused(boolean paused) {
    this.paused = paused;
  }

  @Override
  public String toString() {
    return "[Consumer " + consumerId + " of " + producerId + " for " + clientId
        + (paused ? " (paused)]" : "]");
  }
}
