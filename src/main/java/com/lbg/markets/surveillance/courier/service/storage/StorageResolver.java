package com.lbg.markets.surveillance.courier.service.storage;

import com.lbg.markets.surveillance.courier.config.CourierConfiguration;
import com.lbg.markets.surveillance.courier.exception.UnsupportedProviderException;
import com.lbg.markets.surveillance.courier.model.CloudProvider;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;

/**
 * Picks the storage backend for a provider.
 * <p>
 * In LOCAL mode every provider is simulated under {@code <path>/<provider>/}.
 * In CLOUD mode GCS is served by the real client, LOCAL by the filesystem, and any
 * other provider is rejected.
 */
@ApplicationScoped
public class StorageResolver {

    private static final Logger LOG = Logger.getLogger(StorageResolver.class);

    private final Map<CloudProvider, ObjectStorage> backends;

    @Inject
    public StorageResolver(CourierConfiguration config) {
        this(buildBackends(config.storage()));
    }

    public StorageResolver(Map<CloudProvider, ObjectStorage> backends) {
        this.backends = backends.isEmpty()
                ? new EnumMap<>(CloudProvider.class)
                : new EnumMap<>(backends);
    }

    public ObjectStorage resolve(CloudProvider provider) throws UnsupportedProviderException {
        ObjectStorage storage = backends.get(provider);
        if (storage == null) {
            throw new UnsupportedProviderException(provider);
        }
        return storage;
    }

    private static Map<CloudProvider, ObjectStorage> buildBackends(CourierConfiguration.StorageConfig config) {
        Map<CloudProvider, ObjectStorage> backends = new EnumMap<>(CloudProvider.class);
        Path localRoot = Path.of(config.local().path());

        switch (config.mode()) {
            case LOCAL -> {
                for (CloudProvider provider : CloudProvider.values()) {
                    backends.put(provider, new LocalObjectStorage(localRoot.resolve(provider.getWireName())));
                }
                LOG.infof("Storage running in local mode under %s", localRoot.toAbsolutePath());
            }
            case CLOUD -> {
                backends.put(CloudProvider.LOCAL,
                        new LocalObjectStorage(localRoot.resolve(CloudProvider.LOCAL.getWireName())));
                config.gcs().ifPresentOrElse(
                        gcs -> backends.put(CloudProvider.GCP_GCS, GcsObjectStorage.create(gcs)),
                        () -> LOG.warn("Cloud storage mode without courier.storage.gcs; gcp_gcs events will fail"));
                LOG.infof("Storage running in cloud mode for providers: %s", backends.keySet());
            }
        }
        return backends;
    }
}
