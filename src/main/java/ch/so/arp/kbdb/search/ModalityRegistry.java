package ch.so.arp.kbdb.search;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable lookup table from modality name to {@link Modality}. It is built
 * once while the application context starts and only read afterwards, so it
 * can be shared between request threads without synchronisation.
 */
public final class ModalityRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(ModalityRegistry.class);

    private final Map<String, Modality> modalities;

    public ModalityRegistry(List<Modality> modalities) {
        Objects.requireNonNull(modalities, "modalities");
        if (modalities.isEmpty()) {
            throw new IllegalArgumentException("At least one search modality must be configured");
        }
        Map<String, Modality> byName = new LinkedHashMap<>();
        for (Modality modality : modalities) {
            if (byName.putIfAbsent(modality.name(), modality) != null) {
                throw new IllegalArgumentException("Duplicate search modality '" + modality.name() + "'");
            }
        }
        this.modalities = Collections.unmodifiableMap(byName);
        LOGGER.info("Registered {} search modalities: {}", byName.size(), byName.keySet());
    }

    /**
     * Look up a modality by name.
     *
     * @param name the modality name, e.g. {@code semantic}
     * @return the registered modality
     * @throws UnknownModalityException if no modality with that name exists
     */
    public Modality resolve(String name) {
        Modality modality = name == null ? null : modalities.get(name);
        if (modality == null) {
            throw new UnknownModalityException(name);
        }
        return modality;
    }

    /**
     * All modalities in registration order.
     */
    public Collection<Modality> all() {
        return modalities.values();
    }
}
