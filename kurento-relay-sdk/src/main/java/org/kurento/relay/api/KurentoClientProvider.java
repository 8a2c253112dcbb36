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
package org.kurento.relay.api;

import org.kurento.client.KurentoClient;
import org.kurento.relay.exception.RelayException;

/**
 * This service interface was designed so that the relay could obtain a {@link KurentoClient}
 * instance at any time, without requiring knowledge about the placement of the media server
 * instances. It is left for the developer to provide an implementation for this API.
 */
public interface KurentoClientProvider {

  /**
   * Obtains a {@link KurentoClient} instance. Normally, it'd be called once, when the routing
   * context is created.
   *
   * @return the {@link KurentoClient} instance
   * @throws RelayException ENGINE_UNAVAILABLE in case there is an error obtaining a
   *                        {@link KurentoClient} instance
   */
  KurentoClient getKurentoClient() throws RelayException;

  boolean destroyWhenUnused();
}
