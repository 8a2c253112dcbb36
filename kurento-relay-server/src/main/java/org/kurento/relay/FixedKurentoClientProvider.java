package org.kurento.relay;

import org.kurento.client.KurentoClient;
import org.kurento.commons.exception.KurentoException;
import org.kurento.relay.api.KurentoClientProvider;
import org.kurento.relay.exception.RelayException;
import org.kurento.relay.exception.RelayException.Code;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connects to the single media server configured through {@code relay.kms-uri}.
 */
public class FixedKurentoClientProvider implements KurentoClientProvider {
    private static final Logger log = LoggerFactory.getLogger(FixedKurentoClientProvider.class);

    private final String kmsUri;
    private KurentoClient kurentoClient;

    public FixedKurentoClientProvider(String kmsUri) {
        this.kmsUri = kmsUri;
    }

    @Override
    public synchronized KurentoClient getKurentoClient() throws RelayException {
        if (kurentoClient == null) {
            log.info("Connecting to Kurento Media Server at {}", kmsUri);
            try {
                kurentoClient = KurentoClient.create(kmsUri);
            } catch (KurentoException e) {
                throw new RelayException(Code.ENGINE_UNAVAILABLE_ERROR_CODE,
                        "Unable to connect to the media server at " + kmsUri, e);
            }
        }
        return kurentoClient;
    }

    @Override
    public boolean destroyWhenUnused() {
        return true;
    }
}
