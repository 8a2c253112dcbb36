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

package org.kurento.relay.exception;

/**
 * Exception raised by the relay when a client-originated or internal operation cannot be
 * completed. The {@link Code} travels back to the client inside the error reply.
 */
public class RelayException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public enum Code {
    GENERIC_ERROR_CODE(999),

    INVALID_REQUEST_ERROR_CODE(400),
    FORBIDDEN_ERROR_CODE(403),
    NOT_FOUND_ERROR_CODE(404),
    CONFLICT_ERROR_CODE(409),
    PRECONDITION_FAILED_ERROR_CODE(412),

    ENGINE_UNAVAILABLE_ERROR_CODE(501),
    CONNECT_ERROR_CODE(502),
    PRODUCE_ERROR_CODE(503),
    CONSUME_ERROR_CODE(504),

    RECORDER_START_FAILED_ERROR_CODE(601);

    private int value;

    private Code(int value) {
      this.value = value;
    }

    public int getValue() {
      return this.value;
    }

    /**
     * @return short name of the error kind, as sent to clients (e.g. {@code NotFound})
     */
    public String getKind() {
      switch (this) {
        case INVALID_REQUEST_ERROR_CODE:
          return "InvalidRequest";
        case FORBIDDEN_ERROR_CODE:
          return "Forbidden";
        case NOT_FOUND_ERROR_CODE:
          return "NotFound";
        case CONFLICT_ERROR_CODE:
          return "Conflict";
        case PRECONDITION_FAILED_ERROR_CODE:
          return "PreconditionFailed";
        case ENGINE_UNAVAILABLE_ERROR_CODE:
          return "EngineUnavailable";
        case CONNECT_ERROR_CODE:
          return "ConnectError";
        case PRODUCE_ERROR_CODE:
          return "ProduceError";
        case CONSUME_ERROR_CODE:
          return "ConsumeError";
        case RECORDER_START_FAILED_ERROR_CODE:
          return "RecorderStartFailed";
        default:
          return "GenericError";
      }
    }
  }

  private Code code = Code.GENERIC_ERROR_CODE;

  public RelayException(Code code, String message) {
    super(message);
    this.code = code;
  }

  public RelayException(Code code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public int getCodeValue() {
    return code.getValue();
  }

  @Override
  public String toString() {
    return "Code: " + getCodeValue() + " " + super.toString();
  }
}
