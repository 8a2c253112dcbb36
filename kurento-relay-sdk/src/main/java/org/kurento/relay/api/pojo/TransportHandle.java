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
 * Engine-side transport as seen by the relay. The parameters are relayed untouched to the client
 * so it can build its side of the connection.
 */
public class TransportHandle {
  private final String id;
  private final String clientId;
  private final TransportRole role;
  private final JsonObject parameters;

  public TransportHandle(String id, String clientId, TransportRole role, JsonObject parameters) {
    this.id = id;
    this.clientId = clientId;
    this.role = role;
    this.parameters = parameters != null ? parameters : new JsonObject();
  }

  public String getId() {
    return id;
  }

  public String getClientId() {
    return clientId;
  }

  public TransportRole getRole() {
    return role;
  }

  public JsonObject getParameters() {
    return parameters.deepCopy();
  }

  @Override
  public String toString() {
    return "TransportHandle{id='" + id + "', clientId='" + clientId + "', role=" + role + '}';
  }
}
