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

import java.util.Locale;

import org.kurento.relay.exception.RelayException;
import org.kurento.relay.exception.RelayException.Code;

/**
 * Media kind of a producer or consumer, as named on the wire ({@code audio} / {@code video}).
 */
public enum MediaKind {
  AUDIO, VIDEO;

  public String getValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static MediaKind fromValue(String value) {
    if (value == null) {
      throw new RelayException(Code.INVALID_REQUEST_ERROR_CODE, "Media kind is required");
    }
    for (MediaKind kind : values()) {
      if (kind.getValue().equalsIgnoreCase(value)) {
        return kind;
      }
    }
    throw new RelayException(Code.INVALID_REQUEST_ERROR_CODE, "Unknown media kind '" + value + "'");
  }
}
