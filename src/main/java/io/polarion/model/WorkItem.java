package io.polarion.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.polarion.field.CustomFields;

@JsonInclude(JsonInclude.Include.NON_NULL)
public final class WorkItem {
    public static final String RESOURCE_TYPE = "workitems";

    private String type = RESOURCE_TYPE;
    private String id;
    private String revision;
    private WorkItemAttributes attributes;
    private CustomFields relationships;

    public WorkItem() {
    }

    public WorkItem(String id, WorkItemAttributes attributes) {
        this.id = id;
        this.attributes = attributes;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getRevision() {
        return revision;
    }

    public void setRevision(String revision) {
        this.revision = revision;
    }

    public WorkItemAttributes getAttributes() {
        return attributes;
    }

    public void setAttributes(WorkItemAttributes attributes) {
        this.attributes = attributes;
    }

    /**
     * Relationship envelopes keyed by relationship name ({@code assignee}, {@code author}, ...).
     */
    @JsonProperty("relationships")
    public CustomFields getRelationships() {
        return relationships;
    }

    public void setRelationships(CustomFields relationships) {
        this.relationships = relationships;
    }

    public CustomFields relationships() {
        if (relationships == null) {
            relationships = new CustomFields();
        }
        return relationships;
    }

    public CustomFields customFields() {
        if (attributes == null) {
            attributes = new WorkItemAttributes();
        }
        return attributes.customFields();
    }

    /**
     * The part after the last {@code /}, as used in project-scoped URLs.
     */
    public String localId() {
        if (id == null) {
            return null;
        }
        int slash = id.lastIndexOf('/');
        return slash >= 0 ? id.substring(slash + 1) : id;
    }

    /**
     * Body for PATCH: type, id and writable attributes only.
     */
    public WorkItem toUpdatePayload() {
        WorkItem out = new WorkItem();
        out.id = id;
        out.attributes = attributes == null ? null : attributes.writableCopy();
        return out;
    }
}
