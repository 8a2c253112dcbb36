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
package org.kurento.relay.internal;

import java.util.ArrayDeque;
import java.util.Queue;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the tasks submitted for one client one at a time and in submission order, on top of a
 * shared executor.
 */
public class ClientTaskQueue implements Executor {
  private static final Logger log = LoggerFactory.getLogger(ClientTaskQueue.class);

  private final String clientId;
  private final Executor executor;
  private final Queue<Runnable> tasks = new ArrayDeque<Runnable>();
  private Runnable active;

  public ClientTaskQueue(String clientId, Executor executor) {
    this.clientId = clientId;
    this.executor = executor;
  }

  public String getClientId() {
    return clientId;
  }

  @Override
  public synchronized void execute(final Runnable task) {
    tasks.add(new Runnable() {
      @Override
      public void run() {
        try {
          task.run();
        } catch (RuntimeException e) {
          log.error("CLIENT {}: Unexpected error running queued task", clientId, e);
        } finally {
          scheduleNext();
        }
      }
    });
    if (active == null) {
      scheduleNext();
    }
  }

  public synchronized int getPendingTasks() {
    return tasks.size() + (active != null ? 1 : 0);
  }

  private synchronized void scheduleNext() {
    active = tasks.poll();
    if (active != null) {
      executor.execute(active);
    }
  }
}
