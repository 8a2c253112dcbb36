package org.kurento.relay.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings of the relay server, bound from the {@code relay.*} properties.
 */
@ConfigurationProperties(prefix = "relay")
public class RelayProperties {

    private String kmsUri = "ws://localhost:8888/kurento";
    private final Hls hls = new Hls();
    private final Recording recording = new Recording();
    private final Signaling signaling = new Signaling();

    public String getKmsUri() {
        return kmsUri;
    }

    public void setKmsUri(String kmsUri) {
        this.kmsUri = kmsUri;
    }

    public Hls getHls() {
        return hls;
    }

    public Recording getRecording() {
        return recording;
    }

    public Signaling getSignaling() {
        return signaling;
    }

    public static class Hls {
        private String root = "./hls";
        private String playbackPrefix = "/hls";

        public String getRoot() {
            return root;
        }

        public void setRoot(String root) {
            this.root = root;
        }

        public String getPlaybackPrefix() {
            return playbackPrefix;
        }

        public void setPlaybackPrefix(String playbackPrefix) {
            this.playbackPrefix = playbackPrefix;
        }
    }

    public static class Recording {
        private String ffmpegPath = "ffmpeg";
        private String tapAddress = "127.0.0.1";
        private int rtpMinPort = 40000;
        private int rtpMaxPort = 40999;
        private int segmentSeconds = 2;
        private int listSize = 5;
        private int gopSize = 60;
        private String preset = "veryfast";
        private String videoBitrate = "1000k";
        private String maxRate = "1200k";
        private String bufferSize = "2000k";
        private Duration startupTimeout = Duration.ofSeconds(10);
        private Duration stopTimeout = Duration.ofSeconds(5);

        public String getFfmpegPath() {
            return ffmpegPath;
        }

        public void setFfmpegPath(String ffmpegPath) {
            this.ffmpegPath = ffmpegPath;
        }

        public String getTapAddress() {
            return tapAddress;
        }

        public void setTapAddress(String tapAddress) {
            this.tapAddress = tapAddress;
        }

        public int getRtpMinPort() {
            return rtpMinPort;
        }

        public void setRtpMinPort(int rtpMinPort) {
            this.rtpMinPort = rtpMinPort;
        }

        public int getRtpMaxPort() {
            return rtpMaxPort;
        }

        public void setRtpMaxPort(int rtpMaxPort) {
            this.rtpMaxPort = rtpMaxPort;
        }

        public int getSegmentSeconds() {
            return segmentSeconds;
        }

        public void setSegmentSeconds(int segmentSeconds) {
            this.segmentSeconds = segmentSeconds;
        }

        public int getListSize() {
            return listSize;
        }

        public void setListSize(int listSize) {
            this.listSize = listSize;
        }

        public int getGopSize() {
            return gopSize;
        }

        public void setGopSize(int gopSize) {
            this.gopSize = gopSize;
        }

        public String getPreset() {
            return preset;
        }

        public void setPreset(String preset) {
            this.preset = preset;
        }

        public String getVideoBitrate() {
            return videoBitrate;
        }

        public void setVideoBitrate(String videoBitrate) {
            this.videoBitrate = videoBitrate;
        }

        public String getMaxRate() {
            return maxRate;
        }

        public void setMaxRate(String maxRate) {
            this.maxRate = maxRate;
        }

        public String getBufferSize() {
            return bufferSize;
        }

        public void setBufferSize(String bufferSize) {
            this.bufferSize = bufferSize;
        }

        public Duration getStartupTimeout() {
            return startupTimeout;
        }

        public void setStartupTimeout(Duration startupTimeout) {
            this.startupTimeout = startupTimeout;
        }

        public Duration getStopTimeout() {
            return stopTimeout;
        }

        public void setStopTimeout(Duration stopTimeout) {
            this.stopTimeout = stopTimeout;
        }
    }

    public static class Signaling {
        private String path = "/relay";
        private int workerThreads = 8;

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }
    }
}
