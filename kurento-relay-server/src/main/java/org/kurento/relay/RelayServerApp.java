package org.kurento.relay;

import java.nio.file.Paths;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.kurento.jsonrpc.internal.server.config.JsonRpcConfiguration;
import org.kurento.jsonrpc.server.JsonRpcConfigurer;
import org.kurento.jsonrpc.server.JsonRpcHandlerRegistry;
import org.kurento.relay.api.KurentoClientProvider;
import org.kurento.relay.config.RelayConfig;
import org.kurento.relay.config.RelayProperties;
import org.kurento.relay.internal.KurentoEngineSettings;
import org.kurento.relay.recording.RecordingSettings;
import org.kurento.relay.rpc.RelayJsonRpcHandler;
import org.kurento.relay.rpc.RelayNotificationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

/**
 * Relay server: JSON-RPC signaling over WebSocket plus the HLS playback surface.
 */
@SpringBootApplication
@EnableConfigurationProperties(RelayProperties.class)
@Import({JsonRpcConfiguration.class, RelayConfig.class})
public class RelayServerApp implements JsonRpcConfigurer {
    private static final Logger log = LoggerFactory.getLogger(RelayServerApp.class);

    @Autowired
    private RelayProperties properties;

    @Autowired
    private ObjectProvider<SignalingManager> signalingManager;

    @Bean
    public KurentoClientProvider kmsProvider() {
        return new FixedKurentoClientProvider(properties.getKmsUri());
    }

    @Bean
    public RelayNotificationService notificationService() {
        return new RelayNotificationService();
    }

    @Bean
    public KurentoEngineSettings engineSettings() {
        KurentoEngineSettings settings = new KurentoEngineSettings();
        settings.setRtpMinPort(properties.getRecording().getRtpMinPort());
        settings.setRtpMaxPort(properties.getRecording().getRtpMaxPort());
        return settings;
    }

    @Bean
    public RecordingSettings recordingSettings() {
        RelayProperties.Recording recording = properties.getRecording();
        RecordingSettings settings = new RecordingSettings();
        settings.setHlsRoot(Paths.get(properties.getHls().getRoot()));
        settings.setPlaybackPrefix(properties.getHls().getPlaybackPrefix());
        settings.setFfmpegPath(recording.getFfmpegPath());
        settings.setTapAddress(recording.getTapAddress());
        settings.setSegmentSeconds(recording.getSegmentSeconds());
        settings.setListSize(recording.getListSize());
        settings.setGopSize(recording.getGopSize());
        settings.setPreset(recording.getPreset());
        settings.setVideoBitrate(recording.getVideoBitrate());
        settings.setMaxRate(recording.getMaxRate());
        settings.setBufferSize(recording.getBufferSize());
        settings.setStartupTimeoutMillis(recording.getStartupTimeout().toMillis());
        settings.setStopTimeoutMillis(recording.getStopTimeout().toMillis());
        log.info("HLS output under {}, served at {}", settings.getHlsRoot().toAbsolutePath(),
                settings.getPlaybackPrefix());
        return settings;
    }

    @Bean(name = RelayConfig.WORKER_EXECUTOR, destroyMethod = "shutdown")
    public ExecutorService relayWorkerExecutor() {
        final AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(properties.getSignaling().getWorkerThreads(), new ThreadFactory() {
            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r, "relay-worker-" + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            }
        });
    }

    @Bean
    public RelayJsonRpcHandler relayHandler() {
        return new RelayJsonRpcHandler(signalingManager.getObject(), notificationService());
    }

    @Override
    public void registerJsonRpcHandlers(JsonRpcHandlerRegistry registry) {
        registry.addHandler(relayHandler(), properties.getSignaling().getPath());
    }

    public static void main(String[] args) {
        SpringApplication.run(RelayServerApp.class, args);
    }
}
