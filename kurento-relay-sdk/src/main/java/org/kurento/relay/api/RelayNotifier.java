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

import java.util.Set;

import com.google.gson.JsonObject;

/**
 * Publishes events to connected clients. Implementations own the set of connected clients, so
 * callers never iterate over live connections themselves.
 */
public interface RelayNotifier {

  void sendNotification(String clientId, String method, JsonObject params);

  void broadcast(String method, JsonObject params);

  void broadcastExcept(String excludedClientId, String method, JsonObject params);

  Set<String> getConnectedClients();
}
