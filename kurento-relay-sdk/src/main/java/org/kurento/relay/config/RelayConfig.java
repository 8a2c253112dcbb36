package org.kurento.relay.config;

import java.util.concurrent.Executor;

import org.kurento.relay.SignalingManager;
import org.kurento.relay.api.KurentoClientProvider;
import org.kurento.relay.api.MediaEngine;
import org.kurento.relay.api.RelayHandler;
import org.kurento.relay.api.RelayNotifier;
import org.kurento.relay.internal.KurentoEngineSettings;
import org.kurento.relay.internal.KurentoMediaEngine;
import org.kurento.relay.recording.HlsRecorderFactory;
import org.kurento.relay.recording.RecordingSettings;
import org.kurento.relay.registry.SessionRegistry;
import org.kurento.relay.stream.StreamManager;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the relay core. The application provides the {@link KurentoClientProvider}, the
 * {@link RelayHandler} and {@link RelayNotifier} implementations, both settings objects and the
 * worker executor named {@value #WORKER_EXECUTOR}.
 */
@Configuration
public class RelayConfig {
    public static final String WORKER_EXECUTOR = "relayWorkerExecutor";

    @Bean
    public SessionRegistry sessionRegistry() {
        return new SessionRegistry();
    }

    @Bean
    public KurentoMediaEngine mediaEngine(KurentoClientProvider kcProvider, RelayHandler relayHandler,
                                          KurentoEngineSettings engineSettings) {
        return new KurentoMediaEngine(kcProvider, relayHandler, engineSettings);
    }

    @Bean
    public HlsRecorderFactory hlsRecorderFactory(MediaEngine mediaEngine, SessionRegistry sessionRegistry,
                                                 RecordingSettings recordingSettings) {
        return new HlsRecorderFactory(mediaEngine, sessionRegistry, recordingSettings);
    }

    @Bean
    public StreamManager streamManager(SessionRegistry sessionRegistry, HlsRecorderFactory hlsRecorderFactory,
                                       RelayNotifier notifier,
                                       @Qualifier(WORKER_EXECUTOR) Executor workers) {
        return new StreamManager(sessionRegistry, hlsRecorderFactory, notifier, workers);
    }

    @Bean
    public SignalingManager signalingManager(MediaEngine mediaEngine, SessionRegistry sessionRegistry,
                                             StreamManager streamManager, RelayNotifier notifier,
                                             @Qualifier(WORKER_EXECUTOR) Executor workers) {
        return new SignalingManager(mediaEngine, sessionRegistry, streamManager, notifier, workers);
    }
}
