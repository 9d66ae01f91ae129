package com.cape.label;

import com.cape.label.model.SecurityObject;
import com.cape.label.store.LabelStore;
import com.cape.label.store.PageRequest;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Attaches levels to uniquely identified objects.
 *
 * <p>Generated identifiers are regenerated until the store accepts one. A caller-supplied identifier
 * that is already assigned is reported as an {@link IdentifierConflictException} instead of being
 * replaced.
 */
public class ObjectStore {

    private static final Logger log = LoggerFactory.getLogger(ObjectStore.class);

    private final LabelStore store;
    private final Supplier<String> uuidGenerator;

    public ObjectStore(LabelStore store) {
        this(store, () -> UUID.randomUUID().toString());
    }

    public ObjectStore(LabelStore store, Supplier<String> uuidGenerator) {
        this.store = store;
        this.uuidGenerator = uuidGenerator;
    }

    /**
     * Creates an object carrying {@code levelId}.
     *
     * @param uuid requested identifier, or {@code null} to generate one
     * @throws IdentifierConflictException if {@code uuid} is supplied and already assigned
     */
    public SecurityObject create(long levelId, String uuid) {
        if (uuid != null) {
            if (uuid.isBlank()) {
                throw new IllegalArgumentException("uuid must not be blank");
            }
            if (uuid.length() > SecurityObject.MAX_UUID_LENGTH) {
                throw new IllegalArgumentException(
                        "uuid exceeds " + SecurityObject.MAX_UUID_LENGTH + " characters");
            }
            long id =
                    store.insertObject(uuid, levelId)
                            .orElseThrow(() -> new IdentifierConflictException(uuid));
            return new SecurityObject(id, uuid, levelId);
        }
        while (true) {
            String candidate = uuidGenerator.get();
            var inserted = store.insertObject(candidate, levelId);
            if (inserted.isPresent()) {
                log.debug("Created object {} at level {}", candidate, levelId);
                return new SecurityObject(inserted.get(), candidate, levelId);
            }
            log.warn("Generated object identifier {} collided, regenerating", candidate);
        }
    }

    /** Deletes the object row only; its level and everything below it stay. */
    public void delete(SecurityObject object) {
        store.deleteObject(object.id());
        log.info("Deleted object {}", object.uuid());
    }

    public Optional<SecurityObject> findByUuid(String uuid) {
        return store.findObjectByUuid(uuid);
    }

    public List<String> uuids(PageRequest page) {
        return store.objectUuids(page);
    }
}
