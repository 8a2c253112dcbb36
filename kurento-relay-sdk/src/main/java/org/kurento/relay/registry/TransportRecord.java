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

import org.kurento.relay.api.pojo.TransportHandle;
import org.kurento.relay.api.pojo.TransportRole;

/**
 * Live transport of a client, one per (client, role).
 */
public class TransportRecord {
  private final TransportHandle handle;
  private volatile boolean connected = false;

  public TransportRecord(TransportHandle handle) {
    this.handle = handle;
  }

  public String getId() {
    return handle.getId();
  }

  public TransportRole getRole() {
    return handle.getRole();
  }

  public String getClientId() {
    return handle.getClientId();
  }

  public TransportHandle getHandle() {
    return handle;
  }

  public boolean isConnected() {
    return connected;
  }

  public void setConnected(boolean connected) {
    this.connected = connected;
  }

  @Override
  public String toString() {
    return "[Transport " + getId() + " " + getRole() + " of " + getClientId() + "]";
  }
}
