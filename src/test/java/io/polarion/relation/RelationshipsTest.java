package io.polarion.relation;

import com.fasterxml.jackson.databind.JsonNode;
import io.polarion.field.CustomFields;
import io.polarion.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

final class RelationshipsTest {

    private static JsonNode json(String text) throws Exception {
        return Jsons.mapper().readTree(text);
    }

    @Test
    void singleObjectDecodesToOneReference() throws Exception {
        Optional<RelationshipRef> ref = Relationships.decode(json("{\"data\":{\"type\":\"users\",\"id\":\"jdoe\"}}"));

        Assertions.assertEquals(RelationshipRef.user("jdoe"), ref.orElseThrow());
        Assertions.assertEquals(List.of(RelationshipRef.user("jdoe")),
                Relationships.decodeAll(json("{\"data\":{\"type\":\"users\",\"id\":\"jdoe\"}}")));
    }

    @Test
    void revisionIsKeptWhenPresent() throws Exception {
        RelationshipRef ref = Relationships.decode(
                json("{\"data\":{\"type\":\"documents\",\"id\":\"p/space/Design\",\"revision\":\"1234\"}}")).orElseThrow();

        Assertions.assertEquals(ResourceKind.DOCUMENT, ref.kind());
        Assertions.assertEquals("1234", ref.revision());
        Assertions.assertEquals("p", ref.projectId().orElseThrow());
        Assertions.assertEquals("Design", ref.localId());
    }

    @Test
    void arraySkipsMalformedEntries() throws Exception {
        JsonNode value = json("{\"data\":[{\"type\":\"unknown\",\"id\":\"x\"},{\"type\":\"users\",\"id\":\"\"},"
                + "{\"type\":\"workitems\",\"id\":\"p/WI-2\"},\"junk\",{\"type\":\"users\",\"id\":\"amy\"}]}");

        Assertions.assertEquals(RelationshipRef.workItem("p", "WI-2"), Relationships.decode(value).orElseThrow());
        Assertions.assertEquals(List.of(RelationshipRef.workItem("p", "WI-2"), RelationshipRef.user("amy")),
                Relationships.decodeAll(value));
    }

    @Test
    void bareStringIsAUserForSingleDecodeOnly() throws Exception {
        Assertions.assertEquals(RelationshipRef.user("jdoe"), Relationships.decode(json("\"jdoe\"")).orElseThrow());
        Assertions.assertTrue(Relationships.decode(json("\"\"")).isEmpty());
        Assertions.assertTrue(Relationships.decodeAll(json("\"jdoe\"")).isEmpty());
    }

    @Test
    void unsupportedShapesAreAbsent() throws Exception {
        Assertions.assertTrue(Relationships.decode(null).isEmpty());
        Assertions.assertTrue(Relationships.decode(json("null")).isEmpty());
        Assertions.assertTrue(Relationships.decode(json("{\"data\":null}")).isEmpty());
        Assertions.assertTrue(Relationships.decode(json("{\"links\":{}}")).isEmpty());
        Assertions.assertTrue(Relationships.decode(json("{\"data\":{\"type\":7,\"id\":\"x\"}}")).isEmpty());
        Assertions.assertTrue(Relationships.decode(json("{\"data\":{\"type\":\"users\",\"id\":3}}")).isEmpty());
        Assertions.assertTrue(Relationships.decode(json("42")).isEmpty());
        Assertions.assertTrue(Relationships.decodeAll(json("{\"data\":[]}")).isEmpty());
    }

    @Test
    void encodeWritesDataEnvelope() {
        String single = Jsons.toJson(Relationships.encode(RelationshipRef.user("jdoe")).orElseThrow());
        String withRevision = Jsons.toJson(Relationships.encode(
                RelationshipRef.workItem("p", "WI-1").withRevision("77")).orElseThrow());
        String blankRevision = Jsons.toJson(Relationships.encode(
                RelationshipRef.user("jdoe").withRevision(" ")).orElseThrow());

        Assertions.assertEquals("{\"data\":{\"type\":\"users\",\"id\":\"jdoe\"}}", single);
        Assertions.assertEquals("{\"data\":{\"type\":\"workitems\",\"id\":\"p/WI-1\",\"revision\":\"77\"}}", withRevision);
        Assertions.assertEquals(single, blankRevision);
        Assertions.assertTrue(Relationships.encode(RelationshipRef.user("")).isEmpty());
        Assertions.assertTrue(Relationships.encode(null).isEmpty());
    }

    @Test
    void encodedReferenceDecodesToAnEqualValue() {
        RelationshipRef ref = RelationshipRef.of(ResourceKind.CATEGORY, "p/ui").withRevision("512");

        Assertions.assertEquals(ref, Relationships.decode(Relationships.encode(ref).orElseThrow()).orElseThrow());
    }

    @Test
    void containerStoreAndExtractRoundTrip() {
        CustomFields fields = new CustomFields();
        List<RelationshipRef> refs = List.of(RelationshipRef.user("a"), RelationshipRef.of(ResourceKind.PLAN, "p/sprint-1"));

        fields.setRelationship("assignee", RelationshipRef.user("jdoe"));
        fields.setRelationships("linked", refs);

        Assertions.assertEquals(RelationshipRef.user("jdoe"), fields.getRelationship("assignee").orElseThrow());
        Assertions.assertEquals(refs, fields.getRelationships("linked"));
        Assertions.assertEquals(RelationshipRef.user("a"), fields.getRelationship("linked").orElseThrow());
    }

    @Test
    void emptyReferencesDeleteTheKey() {
        CustomFields fields = new CustomFields();
        fields.setRelationship("assignee", RelationshipRef.user("jdoe"));
        fields.setRelationships("watchers", List.of(RelationshipRef.user("a")));

        fields.setRelationship("assignee", RelationshipRef.user(""));
        fields.setRelationships("watchers", Arrays.asList(RelationshipRef.user(""), null));

        Assertions.assertFalse(fields.has("assignee"));
        Assertions.assertFalse(fields.has("watchers"));
        fields.setRelationship("missing", null);
        Assertions.assertFalse(fields.has("missing"));
    }

    @Test
    void resourceKindsMapToWireTypes() {
        Assertions.assertEquals("workitem_comments", ResourceKind.COMMENT.type());
        Assertions.assertEquals(ResourceKind.LINKED_WORK_ITEM, ResourceKind.fromType("linkedworkitems").orElseThrow());
        Assertions.assertTrue(ResourceKind.fromType("Users").isEmpty());
    }
}
