package com.designgrowth.backend.repository;

import com.designgrowth.backend.exception.DocumentStoreException;
import com.designgrowth.backend.exception.StoreUnavailableException;
import com.designgrowth.backend.model.GrowthDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;

@Repository
@Slf4j
public class MongoDocumentStore implements DocumentStore {

    private final MongoTemplate mongoTemplate;

    @Autowired
    public MongoDocumentStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public <T extends GrowthDocument> String create(T document) {
        String collection = mongoTemplate.getCollectionName(document.getClass());
        try {
            T saved = mongoTemplate.insert(document);
            log.debug("Inserted document {} into '{}'", saved.getId(), collection);
            return saved.getId();
        } catch (DataAccessException e) {
            throw translate("insert into '" + collection + "'", e);
        }
    }

    @Override
    public <T extends GrowthDocument> List<T> list(Class<T> type, DocumentFilter filter, int limit) {
        try {
            return mongoTemplate.find(filter.toQuery(limit), type);
        } catch (DataAccessException e) {
            throw translate("query on '" + mongoTemplate.getCollectionName(type) + "'", e);
        }
    }

    @Override
    public List<String> collectionNames() {
        try {
            return new ArrayList<>(mongoTemplate.getCollectionNames());
        } catch (DataAccessException e) {
            throw translate("listing collections", e);
        }
    }

    private DocumentStoreException translate(String operation, DataAccessException e) {
        log.error("MongoDB failure during {}", operation, e);
        if (e instanceof DataAccessResourceFailureException) {
            return new StoreUnavailableException(e.getMessage(), e);
        }
        return new DocumentStoreException(e.getMessage(), e);
    }
}
