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

import java.util.concurrent.atomic.AtomicLong;

import org.kurento.relay.api.pojo.MediaKind;

/**
 * Outbound producer registered by a client. Records are ordered by creation, which is the order
 * used when looking for a recording source.
 */
public class ProducerRecord {
  private static final AtomicLong sequence = new AtomicLong();

  private final String producerId;
  private final MediaKind kind;
  private final String clientId;
  private final long order;

  public ProducerRecord(String producerId, MediaKind kind, String clientId) {
    this.producerId = producerId;
    this.kind = kind;
    this.clientId = clientId;
    this.order = sequence.incrementAndGet();
  }

  public String getProducerId() {
    return producerId;
  }

  public MediaKind getKind() {
    return kind;
  }

  public String getClientId() {
    return clientId;
  }

  long getOrder() {
    return order;
  }

  @Override
  public String toString() {
    return "[Producer " + producerId + " (" + kind.getValue() + ") of " + clientId + "]";
  }
}
