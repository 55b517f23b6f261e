package com.designgrowth.backend.service;

import com.designgrowth.backend.dto.StoreHealthDTO;
import com.designgrowth.backend.exception.DocumentStoreException;
import com.designgrowth.backend.exception.StoreUnavailableException;
import com.designgrowth.backend.repository.DocumentStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Reports process liveness and store connectivity. Never throws: every store failure becomes a status string.
 */
@Service
@Slf4j
public class StoreHealthService {

    public static final String BACKEND_RUNNING = "✅ Running";
    public static final String DATABASE_CONNECTED = "✅ Connected";
    public static final String DATABASE_NOT_CONNECTED = "❌ Not Connected";
    public static final String DATABASE_ERROR_PREFIX = "⚠️ ";
    static final int MAX_ERROR_LENGTH = 120;

    @Autowired
    private DocumentStore documentStore;

    public StoreHealthDTO check() {
        StoreHealthDTO health = StoreHealthDTO.builder()
                .backend(BACKEND_RUNNING)
                .collections(List.of())
                .build();
        try {
            health.setCollections(documentStore.collectionNames());
            health.setDatabase(DATABASE_CONNECTED);
        } catch (StoreUnavailableException e) {
            log.warn("Store health check: MongoDB unreachable");
            health.setDatabase(DATABASE_NOT_CONNECTED);
        } catch (DocumentStoreException e) {
            log.warn("Store health check failed: {}", e.getMessage());
            health.setDatabase(DATABASE_ERROR_PREFIX + truncate(String.valueOf(e.getMessage())));
        }
        return health;
    }

    private static String truncate(String message) {
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }
}
