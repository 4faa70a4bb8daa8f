package io.polarion.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.polarion.error.ValidationException;
import io.polarion.http.CancellationToken;
import io.polarion.http.ResponseDecoder;
import io.polarion.model.WorkItem;
import io.polarion.relation.RelationshipRef;
import io.polarion.relation.Relationships;
import io.polarion.relation.ResourceKind;
import io.polarion.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;

public final class WorkItemService {
    private static final Logger LOG = LoggerFactory.getLogger(WorkItemService.class);

    private final PolarionClient client;
    private final String projectId;

    WorkItemService(PolarionClient client, String projectId) {
        if (projectId == null || projectId.isBlank()) {
            throw new ValidationException("projectId", "project id is required");
        }
        this.client = client;
        this.projectId = projectId.trim();
    }

    public String projectId() {
        return projectId;
    }

    public WorkItem get(String workItemId) {
        return get(CancellationToken.create(), workItemId);
    }

    public WorkItem get(CancellationToken token, String workItemId) {
        return client.getEnvelope(token, itemPath(workItemId), WorkItem.class);
    }

    /**
     * Creates the items in one request and returns references to them in request order.
     */
    public List<RelationshipRef> create(List<WorkItem> items) {
        return create(CancellationToken.create(), items);
    }

    public List<RelationshipRef> create(CancellationToken token, List<WorkItem> items) {
        if (items == null || items.isEmpty()) {
            throw new ValidationException("items", "at least one work item is required");
        }
        ArrayNode data = Jsons.mapper().createArrayNode();
        for (WorkItem item : items) {
            ObjectNode node = Jsons.mapper().valueToTree(item);
            node.remove("id");
            node.remove("revision");
            node.put("type", WorkItem.RESOURCE_TYPE);
            data.add(node);
        }
        ObjectNode body = Jsons.mapper().createObjectNode();
        body.set("data", data);
        JsonNode created = ResponseDecoder.decodeRaw(client.execute(token, "POST", collectionPath(), body), JsonNode.class);
        List<RelationshipRef> refs = Relationships.decodeAll(created);
        LOG.debug("created {} work item(s) in {}", refs.size(), projectId);
        return refs;
    }

    /**
     * Sends the writable attributes of {@code item}; {@code created} and {@code updated} are
     * server-maintained and never sent.
     */
    public void update(WorkItem item) {
        update(CancellationToken.create(), item);
    }

    public void update(CancellationToken token, WorkItem item) {
        if (item == null || item.getId() == null || item.getId().isBlank()) {
            throw new ValidationException("id", "work item id is required for update");
        }
        WorkItem payload = item.toUpdatePayload();
        payload.setId(qualifiedId(item.getId()));
        ObjectNode body = Jsons.mapper().createObjectNode();
        body.set("data", Jsons.mapper().valueToTree(payload));
        ResponseDecoder.discard(client.execute(token, "PATCH", itemPath(item.getId()), body));
    }

    public void delete(List<String> workItemIds) {
        delete(CancellationToken.create(), workItemIds);
    }

    public void delete(CancellationToken token, List<String> workItemIds) {
        if (workItemIds == null || workItemIds.isEmpty()) {
            throw new ValidationException("ids", "at least one work item id is required");
        }
        ArrayNode data = Jsons.mapper().createArrayNode();
        for (String id : workItemIds) {
            ObjectNode node = data.addObject();
            node.put("type", ResourceKind.WORK_ITEM.type());
            node.put("id", qualifiedId(id));
        }
        ObjectNode body = Jsons.mapper().createObjectNode();
        body.set("data", data);
        ResponseDecoder.discard(client.execute(token, "DELETE", collectionPath(), body));
    }

    String collectionPath() {
        return "projects/" + encode(projectId) + "/workitems";
    }

    String itemPath(String workItemId) {
        return collectionPath() + "/" + encode(localId(workItemId));
    }

    String qualifiedId(String workItemId) {
        String local = localId(workItemId);
        return projectId + "/" + local;
    }

    private static String localId(String workItemId) {
        if (workItemId == null || workItemId.isBlank()) {
            throw new ValidationException("id", "work item id is required");
        }
        String trimmed = workItemId.trim();
        int slash = trimmed.lastIndexOf('/');
        String local = slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
        if (local.isEmpty()) {
            throw new ValidationException("id", "work item id is required");
        }
        return local;
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
