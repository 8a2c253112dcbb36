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

/**
 * Names of the JSON-RPC methods, notifications and parameters of the relay protocol.
 */
public final class ProtocolElements {

  public static final String GETRTPCAPABILITIES_METHOD = "getRtpCapabilities";
  public static final String GETRTPCAPABILITIES_RTPCAPABILITIES_PARAM = "rtpCapabilities";

  public static final String SETRTPCAPABILITIES_METHOD = "setRtpCapabilities";
  public static final String SETRTPCAPABILITIES_RTPCAPABILITIES_PARAM = "rtpCapabilities";

  public static final String CREATEPRODUCERTRANSPORT_METHOD = "createProducerTransport";
  public static final String CREATECONSUMERTRANSPORT_METHOD = "createConsumerTransport";
  public static final String CREATETRANSPORT_ID_PARAM = "id";

  public static final String CONNECTPRODUCERTRANSPORT_METHOD = "connectProducerTransport";
  public static final String CONNECTCONSUMERTRANSPORT_METHOD = "connectConsumerTransport";
  public static final String CONNECTTRANSPORT_DTLSPARAMETERS_PARAM = "dtlsParameters";

  public static final String ADDICECANDIDATE_METHOD = "addIceCandidate";
  public static final String ADDICECANDIDATE_ROLE_PARAM = "role";
  public static final String ADDICECANDIDATE_CANDIDATE_PARAM = "candidate";

  public static final String PRODUCE_METHOD = "produce";
  public static final String PRODUCE_KIND_PARAM = "kind";
  public static final String PRODUCE_RTPPARAMETERS_PARAM = "rtpParameters";
  public static final String PRODUCE_ID_PARAM = "id";

  public static final String CONSUME_METHOD = "consume";
  public static final String CONSUME_PRODUCERID_PARAM = "producerId";
  public static final String CONSUME_ID_PARAM = "id";
  public static final String CONSUME_KIND_PARAM = "kind";
  public static final String CONSUME_RTPPARAMETERS_PARAM = "rtpParameters";

  public static final String RESUMECONSUMER_METHOD = "resumeConsumer";
  public static final String RESUMECONSUMER_CONSUMERID_PARAM = "consumerId";

  public static final String GETPRODUCERS_METHOD = "getProducers";
  public static final String GETPRODUCERS_PRODUCERLIST_PARAM = "producerList";
  public static final String GETPRODUCERS_PRODUCERID_PARAM = "producerId";
  public static final String GETPRODUCERS_CLIENTID_PARAM = "clientId";

  public static final String STARTHLSSTREAM_METHOD = "startHLSStream";
  public static final String STOPHLSSTREAM_METHOD = "stopHLSStream";
  public static final String HLSSTREAM_STREAMID_PARAM = "streamId";
  public static final String HLSSTREAM_PLAYLISTURL_PARAM = "playlistUrl";

  public static final String GETACTIVESTREAMS_METHOD = "getActiveStreams";
  public static final String GETACTIVESTREAMS_STREAMS_PARAM = "streams";

  public static final String HEALTHCHECK_METHOD = "healthCheck";
  public static final String HEALTHCHECK_STATUS_PARAM = "status";

  public static final String SUCCESS_PARAM = "success";

  // ---------------------------- SERVER EVENTS -----------------------------

  public static final String NEWPRODUCER_METHOD = "newProducer";
  public static final String NEWPRODUCER_PRODUCERID_PARAM = "producerId";
  public static final String NEWPRODUCER_CLIENTID_PARAM = "clientId";

  public static final String PRODUCERCLOSED_METHOD = "producerClosed";
  public static final String PRODUCERCLOSED_PRODUCERID_PARAM = "producerId";

  public static final String STREAMLIVE_METHOD = "streamLive";
  public static final String STREAMENDED_METHOD = "streamEnded";

  public static final String ICECANDIDATE_METHOD = "iceCandidate";
  public static final String ICECANDIDATE_TRANSPORTID_PARAM = "transportId";
  public static final String ICECANDIDATE_ROLE_PARAM = "role";
  public static final String ICECANDIDATE_CANDIDATE_PARAM = "candidate";

  public static final String MEDIAERROR_METHOD = "mediaError";
  public static final String MEDIAERROR_ERROR_PARAM = "error";

  private ProtocolElements() {
  }
}
