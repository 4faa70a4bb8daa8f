package io.polarion.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.polarion.client.PolarionClient;
import io.polarion.config.PolarionConfig;
import io.polarion.error.ApiErrors;
import io.polarion.error.PolarionException;
import io.polarion.field.CustomFields;
import io.polarion.field.FieldFormats;
import io.polarion.field.FieldKind;
import io.polarion.field.TextContent;
import io.polarion.http.RetryConfig;
import io.polarion.model.WorkItem;
import io.polarion.model.WorkItemAttributes;
import io.polarion.relation.RelationshipRef;
import io.polarion.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
        name = "polarion",
        mixinStandardHelpOptions = true,
        description = "Polarion work-item REST client",
        subcommands = {
                PolarionCommand.GetCommand.class,
                PolarionCommand.FieldsCommand.class,
                PolarionCommand.SetFieldCommand.class
        }
)
public final class PolarionCommand implements Runnable {
    private static final Logger LOG = LoggerFactory.getLogger(PolarionCommand.class);

    @Spec
    CommandSpec spec;

    @Option(names = {"--url"}, description = "REST base URL (default: $POLARION_URL)", defaultValue = "${env:POLARION_URL}")
    String url;

    @Option(names = {"--token"}, description = "Personal access token (default: $POLARION_TOKEN)", defaultValue = "${env:POLARION_TOKEN}")
    String token;

    @Option(names = {"--retries"}, description = "Retries after a failed request", defaultValue = "1")
    int retries;

    @Option(names = {"--timeout-seconds"}, description = "Per-request timeout", defaultValue = "30")
    long timeoutSeconds;

    @Override
    public void run() {
        out().println("Use subcommands: get | fields | set-field");
    }

    PolarionClient client() {
        PolarionConfig config = PolarionConfig.of(url, token)
                .withRetry(RetryConfig.defaults().withMaxRetries(retries))
                .withRequestTimeout(Duration.ofSeconds(timeoutSeconds));
        return PolarionClient.create(config);
    }

    PrintWriter out() {
        return spec.commandLine().getOut();
    }

    PrintWriter err() {
        return spec.commandLine().getErr();
    }

    int fail(String action, RuntimeException e) {
        LOG.error("{} failed: {}", action, e.getMessage());
        if (ApiErrors.isNotFound(e)) {
            err().println("{\"error\":\"work item not found\"}");
        } else {
            err().println(Jsons.toJson(Map.of("error", ApiErrors.detailedMessage(e))));
        }
        return e instanceof PolarionException ? 1 : 2;
    }

    @Command(name = "get", description = "Print a work item as JSON")
    static final class GetCommand implements Callable<Integer> {
        @ParentCommand
        PolarionCommand parent;

        @Parameters(index = "0", description = "Project id")
        String projectId;

        @Parameters(index = "1", description = "Work item id (WI-1 or project/WI-1)")
        String workItemId;

        @Override
        public Integer call() {
            try {
                WorkItem item = parent.client().workItems(projectId).get(workItemId);
                parent.out().println(Jsons.toPrettyJson(item));
                return 0;
            } catch (PolarionException | IllegalArgumentException e) {
                return parent.fail("get " + workItemId, e);
            }
        }
    }

    @Command(name = "fields", description = "List custom fields with their inferred kind")
    static final class FieldsCommand implements Callable<Integer> {
        @ParentCommand
        PolarionCommand parent;

        @Parameters(index = "0", description = "Project id")
        String projectId;

        @Parameters(index = "1", description = "Work item id")
        String workItemId;

        @Override
        public Integer call() {
            try {
                WorkItem item = parent.client().workItems(projectId).get(workItemId);
                CustomFields fields = item.customFields();
                for (String key : fields.keys()) {
                    Optional<JsonNode> raw = fields.raw(key);
                    String kind = raw.map(FieldsCommand::inferKind).map(FieldKind::wireName).orElse("null");
                    parent.out().println(key + "\t" + kind + "\t" + raw.map(JsonNode::toString).orElse("null"));
                }
                return 0;
            } catch (PolarionException | IllegalArgumentException e) {
                return parent.fail("fields " + workItemId, e);
            }
        }

        static FieldKind inferKind(JsonNode value) {
            if (value.isBoolean()) {
                return FieldKind.BOOLEAN;
            }
            if (value.isIntegralNumber()) {
                return FieldKind.INTEGER;
            }
            if (value.isNumber()) {
                return FieldKind.FLOAT;
            }
            if (value.isObject()) {
                if (value.has("data")) {
                    return FieldKind.RELATIONSHIP;
                }
                if (value.has("keys") && value.has("rows")) {
                    return FieldKind.TABLE;
                }
                if (TextContent.HTML.equals(value.path("type").asText())) {
                    return FieldKind.TEXT_HTML;
                }
                return FieldKind.TEXT;
            }
            return FieldKind.STRING;
        }
    }

    @Command(name = "set-field", description = "Update one custom field of a work item")
    static final class SetFieldCommand implements Callable<Integer> {
        @ParentCommand
        PolarionCommand parent;

        @Parameters(index = "0", description = "Project id")
        String projectId;

        @Parameters(index = "1", description = "Work item id")
        String workItemId;

        @Parameters(index = "2", description = "Custom field id")
        String field;

        @Parameters(index = "3", description = "New value")
        String value;

        @Option(names = {"--kind"}, defaultValue = "string",
                description = "Value kind: string|integer|float|boolean|date|time|date-time|duration|enumeration|text/html|relationship")
        String kind;

        @Override
        public Integer call() {
            try {
                FieldKind fieldKind = FieldKind.fromWireName(kind)
                        .orElseThrow(() -> new IllegalArgumentException("unknown field kind: " + kind));
                WorkItem patch = new WorkItem(workItemId, new WorkItemAttributes());
                apply(patch.customFields(), field, fieldKind, value);
                parent.client().workItems(projectId).update(patch);
                parent.out().println("Updated " + field + " on " + workItemId);
                return 0;
            } catch (PolarionException | IllegalArgumentException e) {
                return parent.fail("set-field " + field, e);
            }
        }

        static void apply(CustomFields fields, String key, FieldKind kind, String raw) {
            switch (kind) {
                case INTEGER -> fields.set(key, Long.parseLong(raw.trim()));
                case FLOAT, CURRENCY -> fields.set(key, new BigDecimal(raw.trim()));
                case BOOLEAN -> fields.set(key, parseBoolean(raw));
                case DATE -> fields.setDate(key, FieldFormats.parseDate(raw.trim()));
                case TIME -> fields.setTime(key, FieldFormats.parseTime(raw.trim()));
                case DATE_TIME -> fields.setDateTime(key, FieldFormats.parseDateTime(raw.trim()));
                case DURATION -> fields.setDuration(key, FieldFormats.parseDuration(raw.trim()));
                case TEXT, TEXT_HTML -> fields.set(key, TextContent.html(raw));
                case RELATIONSHIP -> fields.setRelationship(key, RelationshipRef.user(raw.trim()));
                case TABLE, STRUCTURE -> throw new IllegalArgumentException("kind " + kind.wireName() + " cannot be set from the command line");
                default -> fields.set(key, raw);
            }
        }

        private static boolean parseBoolean(String raw) {
            String value = raw.trim().toLowerCase(Locale.ROOT);
            if ("true".equals(value)) {
                return true;
            }
            if ("false".equals(value)) {
                return false;
            }
            throw new IllegalArgumentException("invalid boolean: " + raw);
        }
    }
}
