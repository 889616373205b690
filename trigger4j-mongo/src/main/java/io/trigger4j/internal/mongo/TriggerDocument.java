package io.trigger4j.internal.mongo;

import io.trigger4j.core.TriggerKind;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

/**
 * Mongo document model for triggers.
 *
 * <p>The API schema is stored as an ordered list of (field, type tag) pairs so that field order
 * survives the round trip and field names may contain dots.
 */
@Document(collection = "triggers")
public class TriggerDocument {

    @Id
    private String id;

    private String ownerId;
    private String name;
    private TriggerKind kind;
    private String schedule;
    private List<SchemaField> apiSchema;
    private Instant createdAt;

    public TriggerDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public void setOwnerId(String ownerId) {
        this.ownerId = ownerId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public TriggerKind getKind() {
        return kind;
    }

    public void setKind(TriggerKind kind) {
        this.kind = kind;
    }

    public String getSchedule() {
        return schedule;
    }

    public void setSchedule(String schedule) {
        this.schedule = schedule;
    }

    public List<SchemaField> getApiSchema() {
        return apiSchema;
    }

    public void setApiSchema(List<SchemaField> apiSchema) {
        this.apiSchema = apiSchema;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public static class SchemaField {
        private String field;
        private String type;

        public SchemaField() {
        }

        public SchemaField(String field, String type) {
            this.field = field;
            this.type = type;
        }

        public String getField() {
            return field;
        }

        public void setField(String field) {
            this.field = field;
        }

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }
    }
}
