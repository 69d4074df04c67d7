package com.example.chatorchestrator.store;

import java.util.*;
import java.util.function.Consumer;
import java.util.stream.Collectors;

import com.mongodb.client.model.changestream.ChangeStreamDocument;
import com.mongodb.client.model.changestream.FullDocument;
import jakarta.annotation.PreDestroy;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.messaging.ChangeStreamRequest;
import org.springframework.data.mongodb.core.messaging.DefaultMessageListenerContainer;
import org.springframework.data.mongodb.core.messaging.MessageListener;
import org.springframework.data.mongodb.core.messaging.MessageListenerContainer;
import org.springframework.data.mongodb.core.messaging.Subscription;
import org.springframework.data.mongodb.core.query.BasicQuery;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "app.store.type", havingValue = "mongo", matchIfMissing = true)
public class MongoStoreClient implements StoreClient {

    private static final Logger logger = LoggerFactory.getLogger(MongoStoreClient.class);

    private final MongoTemplate mongo;
    private final MessageListenerContainer changeStreams;

    @Autowired
    public MongoStoreClient(MongoTemplate mongo) {
        this.mongo = mongo;
        this.changeStreams = new DefaultMessageListenerContainer(mongo);
    }

    @Override
    public void put(String collection, String key, Map<String, Object> doc) {
        Document d = new Document(doc);
        d.put("_id", key);
        mongo.save(d, collection);
    }

    @Override
    public Optional<Map<String, Object>> get(String collection, String key) {
        return Optional.ofNullable(mongo.findById(key, Document.class, collection));
    }

    @Override
    public void delete(String collection, String key) {
        mongo.remove(byId(key), collection);
    }

    @Override
    public List<Map<String, Object>> find(String collection, Map<String, Object> filter, Map<String, Integer> sort, Integer limit) {
        Query q = new BasicQuery(new Document(filter == null ? Map.of() : filter));
        if (sort != null && !sort.isEmpty()) {
            List<Sort.Order> orders = sort.entrySet().stream()
                .map(e -> new Sort.Order(e.getValue() != null && e.getValue() < 0 ? Sort.Direction.DESC : Sort.Direction.ASC, e.getKey()))
                .collect(Collectors.toList());
            q.with(Sort.by(orders));
        }
        if (limit != null && limit > 0) q.limit(limit);
        List<Document> docs = mongo.find(q, Document.class, collection);
        return new ArrayList<>(docs);
    }

    @Override
    public void updateFields(String collection, String key, Map<String, Object> fields) {
        if (fields == null || fields.isEmpty()) return;
        Update update = new Update();
        fields.forEach(update::set);
        mongo.upsert(byId(key), update, collection);
    }

    @Override
    public void addToSet(String collection, String key, String field, Object value) {
        mongo.upsert(byId(key), new Update().addToSet(field, value), collection);
    }

    @Override
    public void removeFromSet(String collection, String key, String field, Object value) {
        mongo.updateFirst(byId(key), new Update().pull(field, value), collection);
    }

    @Override
    public StoreSubscription subscribe(String collection, Map<String, Object> filter, Consumer<Map<String, Object>> callback) {
        // change events carry the document under fullDocument
        Document match = new Document();
        if (filter != null) {
            filter.forEach((field, value) -> match.put("fullDocument." + field, value));
        }
        ChangeStreamRequest<Document> request = ChangeStreamRequest.<Document>builder()
                .collection(collection)
                .filter(new Document("$match", match))
                .fullDocumentLookup(FullDocument.UPDATE_LOOKUP)
                .publishTo(changeListener(callback))
                .build();
        synchronized (changeStreams) {
            if (!changeStreams.isRunning()) {
                changeStreams.start();
            }
        }
        Subscription subscription = changeStreams.register(request, Document.class);
        logger.debug("Watching {} with filter {}", collection, filter);
        return subscription::cancel;
    }

    // deletes carry no full document and are skipped
    static MessageListener<ChangeStreamDocument<Document>, Document> changeListener(Consumer<Map<String, Object>> callback) {
        return message -> {
            Document body = message.getBody();
            if (body != null) {
                callback.accept(body);
            }
        };
    }

    @PreDestroy
    public void stop() {
        changeStreams.stop();
    }

    private static Query byId(String key) {
        return Query.query(Criteria.where("_id").is(key));
    }
}
