package com.apiflow.engine;

import com.apiflow.model.InterfaceDocument;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/**
 * Read-through cache of parsed interface documents, one per engine instance.
 * <p>
 * Entries are never evicted. Concurrent first use may load the same document twice; loading is
 * idempotent, so the first stored value simply wins and no lock is held while fetching.
 */
@Component
public class DocumentCache {

    /**
     * Identity of a cached document: the API version as seen by one auth context, thread and
     * credential.
     */
    public record Key(String serviceId, String version, String authContext, long threadId,
                      String credentialFingerprint, String developerKey, String labels, int sourceHash) {
    }

    private final Map<Key, InterfaceDocument> documents = new ConcurrentHashMap<>();

    public InterfaceDocument get(Key key, Supplier<InterfaceDocument> loader) {
        InterfaceDocument cached = documents.get(key);
        if (cached != null) {
            return cached;
        }
        InterfaceDocument loaded = loader.get();
        InterfaceDocument raced = documents.putIfAbsent(key, loaded);
        return raced != null ? raced : loaded;
    }

    public int size() {
        return documents.size();
    }
}
