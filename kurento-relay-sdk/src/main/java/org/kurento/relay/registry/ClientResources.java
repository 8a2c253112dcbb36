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

import java.util.Collections;
import java.util.List;

/**
 * Records removed from the registry for a client. The caller is responsible for releasing the
 * matching engine resources.
 */
public class ClientResources {
  private final String clientId;
  private final List<TransportRecord> transports;
  private final List<ProducerRecord> producers;
  private final List<ConsumerRecord> consumers;

  public ClientResources(String clientId, List<TransportRecord> transports,
      List<ProducerRecord> producers, List<ConsumerRecord> consumers) {
    this.clientId = clientId;
    this.transports = Collections.unmodifiableList(transports);
    this.producers = Collections.unmodifiableList(producers);
    this.consumers = Collections.unmodifiableList(consumers);
  }

  public static ClientResources empty(String clientId) {
    return new ClientResources(clientId, Collections.<TransportRecord>emptyList(),
        Collections.<ProducerRecord>emptyList(), Collections.<ConsumerRecord>emptyList());
  }

  public String getClientId() {
    return clientId;
  }

  public List<TransportRecord> getTransports() {
    return transports;
  }

  public List<ProducerRecord> getProducers() {
    return producers;
  }

  public List<ConsumerRecord> getConsumers() {
    return consumers;
  }

  public boolean isEmpty() {
    return transports.isEmpty() && producers.isEmpty() && consumers.isEmpty();
  }
}
