package io.polarion.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import io.polarion.field.CustomFields;
import io.polarion.field.TextContent;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public final class WorkItemAttributes {
    private String type;
    private String title;
    private TextContent description;
    private String status;
    private String resolution;
    private String priority;
    private String severity;
    private String dueDate;
    private String initialEstimate;
    private String remainingEstimate;
    private String timeSpent;
    private String outlineNumber;
    private OffsetDateTime created;
    private OffsetDateTime updated;
    private OffsetDateTime resolvedOn;
    private List<Hyperlink> hyperlinks;

    @JsonIgnore
    private final CustomFields customFields = new CustomFields();

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public TextContent getDescription() {
        return description;
    }

    public void setDescription(TextContent description) {
        this.description = description;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getResolution() {
        return resolution;
    }

    public void setResolution(String resolution) {
        this.resolution = resolution;
    }

    public String getPriority() {
        return priority;
    }

    public void setPriority(String priority) {
        this.priority = priority;
    }

    public String getSeverity() {
        return severity;
    }

    public void setSeverity(String severity) {
        this.severity = severity;
    }

    public String getDueDate() {
        return dueDate;
    }

    public void setDueDate(String dueDate) {
        this.dueDate = dueDate;
    }

    public String getInitialEstimate() {
        return initialEstimate;
    }

    public void setInitialEstimate(String initialEstimate) {
        this.initialEstimate = initialEstimate;
    }

    public String getRemainingEstimate() {
        return remainingEstimate;
    }

    public void setRemainingEstimate(String remainingEstimate) {
        this.remainingEstimate = remainingEstimate;
    }

    public String getTimeSpent() {
        return timeSpent;
    }

    public void setTimeSpent(String timeSpent) {
        this.timeSpent = timeSpent;
    }

    public String getOutlineNumber() {
        return outlineNumber;
    }

    public void setOutlineNumber(String outlineNumber) {
        this.outlineNumber = outlineNumber;
    }

    public OffsetDateTime getCreated() {
        return created;
    }

    public void setCreated(OffsetDateTime created) {
        this.created = created;
    }

    public OffsetDateTime getUpdated() {
        return updated;
    }

    public void setUpdated(OffsetDateTime updated) {
        this.updated = updated;
    }

    public OffsetDateTime getResolvedOn() {
        return resolvedOn;
    }

    public void setResolvedOn(OffsetDateTime resolvedOn) {
        this.resolvedOn = resolvedOn;
    }

    public List<Hyperlink> getHyperlinks() {
        return hyperlinks;
    }

    public void setHyperlinks(List<Hyperlink> hyperlinks) {
        this.hyperlinks = hyperlinks;
    }

    public CustomFields customFields() {
        return customFields;
    }

    @JsonAnySetter
    public void putCustomField(String name, JsonNode value) {
        customFields.set(name, value);
    }

    @JsonAnyGetter
    public Map<String, JsonNode> customFieldValues() {
        Map<String, JsonNode> out = new LinkedHashMap<>();
        customFields.asNode().fields().forEachRemaining(entry -> out.put(entry.getKey(), entry.getValue()));
        return out;
    }

    /**
     * Copy without the type and the server-maintained timestamps, used as the body of an update.
     */
    WorkItemAttributes writableCopy() {
        WorkItemAttributes copy = new WorkItemAttributes();
        copy.title = title;
        copy.description = description;
        copy.status = status;
        copy.resolution = resolution;
        copy.priority = priority;
        copy.severity = severity;
        copy.dueDate = dueDate;
        copy.initialEstimate = initialEstimate;
        copy.remainingEstimate = remainingEstimate;
        copy.timeSpent = timeSpent;
        copy.outlineNumber = outlineNumber;
        copy.hyperlinks = hyperlinks;
        copy.customFields.asNode().setAll(customFields.asNode().deepCopy());
        return copy;
    }
}
