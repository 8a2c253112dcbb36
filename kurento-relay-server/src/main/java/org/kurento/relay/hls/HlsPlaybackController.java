package org.kurento.relay.hls;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.kurento.relay.config.RelayProperties;
import org.kurento.relay.exception.RelayException;
import org.kurento.relay.exception.RelayException.Code;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

/**
 * Serves the playlists and segments written by the recorders. Only files below the HLS root can be
 * retrieved.
 */
@RestController
public class HlsPlaybackController {
    private static final Logger log = LoggerFactory.getLogger(HlsPlaybackController.class);

    static final MediaType PLAYLIST_TYPE = MediaType.parseMediaType("application/vnd.apple.mpegurl");
    static final MediaType SEGMENT_TYPE = MediaType.parseMediaType("video/mp2t");

    private final Path hlsRoot;

    public HlsPlaybackController(RelayProperties properties) {
        this.hlsRoot = Paths.get(properties.getHls().getRoot()).toAbsolutePath().normalize();
    }

    @GetMapping("${relay.hls.playback-prefix:/hls}/{streamKey}/{file:.+}")
    public ResponseEntity<Resource> getFile(@PathVariable String streamKey, @PathVariable String file) {
        Path path = hlsRoot.resolve(streamKey).resolve(file).normalize();
        if (!path.startsWith(hlsRoot)) {
            throw new RelayException(Code.FORBIDDEN_ERROR_CODE, "Access denied");
        }
        if (!Files.isRegularFile(path)) {
            throw new RelayException(Code.NOT_FOUND_ERROR_CODE, "File not found");
        }
        return ResponseEntity.ok()
                .contentType(contentType(path))
                .header(HttpHeaders.CACHE_CONTROL, "no-cache, no-store, must-revalidate")
                .header(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "*")
                .body(new FileSystemResource(path));
    }

    @ExceptionHandler(RelayException.class)
    public ResponseEntity<String> handleRelayException(RelayException e) {
        HttpStatus status;
        switch (e.getCode()) {
            case FORBIDDEN_ERROR_CODE:
                log.warn("Rejected HLS request outside {}", hlsRoot);
                status = HttpStatus.FORBIDDEN;
                break;
            case NOT_FOUND_ERROR_CODE:
                status = HttpStatus.NOT_FOUND;
                break;
            default:
                status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return ResponseEntity.status(status).contentType(MediaType.TEXT_PLAIN).body(e.getMessage());
    }

    static MediaType contentType(Path path) {
        String name = path.getFileName().toString();
        if (name.endsWith(".m3u8")) {
            return PLAYLIST_TYPE;
        }
        if (name.endsWith(".ts")) {
            return SEGMENT_TYPE;
        }
        return MediaType.APPLICATION_OCTET_STREAM;
    }
}
