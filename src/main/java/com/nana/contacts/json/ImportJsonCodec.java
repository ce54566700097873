package com.nana.contacts.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.nana.contacts.domain.CandidateRecord;
import com.nana.contacts.domain.Contact;
import com.nana.contacts.domain.ContactField;
import com.nana.contacts.importer.ImportAction;
import com.nana.contacts.importer.ImportDecision;
import com.nana.contacts.importer.ImportOutcome;
import com.nana.contacts.importer.ImportOutcome.RowFailure;
import com.nana.contacts.importer.ParseDiagnostics.RowError;
import com.nana.contacts.importer.ValidationFinding;
import com.nana.contacts.importer.match.DuplicateMatch;
import com.nana.contacts.service.ExecuteRequest;
import com.nana.contacts.service.ImportPreview;
import com.nana.contacts.service.ImportRejectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * ImportJsonCodec - JSON bodies of the preview and execute calls.
 *
 * <p>READS:
 * <pre>
 * {
 *   "contacts": [ { "rowNumber": 1, "fullName": "...", ..., "rawFields": {...} } ],
 *   "actions":  [ { "action": "update", "rowNumber": 1, "existingId": 7 } ]
 * }
 * </pre>
 * An action may instead carry its row as {@code parsedContact.rowNumber}
 * and its target as {@code existingContactId}.
 *
 * <p>WRITES: preview responses, import outcomes and {@code {error, details}}
 * error bodies. Absent contact fields are omitted. Enum values are written
 * in their lowercase wire form ({@code fuzzy_name}, {@code high},
 * {@code create}).
 */
public final class ImportJsonCodec {

    private static final Logger log = LoggerFactory.getLogger(ImportJsonCodec.class);

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private static final String SEVERITY_WARNING = "warning";

    private ImportJsonCodec() {}

    // -----------------------------------------------------------------------
    // READ
    // -----------------------------------------------------------------------

    /**
     * Reads an execute request body.
     *
     * @param json the request text
     * @return the decoded request
     * @throws IOException if the text is not JSON or lacks a required value
     */
    public static ExecuteRequest readExecuteRequest(String json) throws IOException {
        JsonNode root = objectMapper.readTree(json == null ? "" : json);
        if (root == null || !root.isObject()) {
            throw new IOException("Execute request must be a JSON object");
        }

        List<CandidateRecord> contacts = new ArrayList<>();
        for (JsonNode node : arrayOf(root, "contacts")) {
            contacts.add(readCandidate(node));
        }

        List<ImportDecision> actions = new ArrayList<>();
        for (JsonNode node : arrayOf(root, "actions")) {
            actions.add(readDecision(node));
        }

        log.debug("Decoded execute request: {} contacts, {} actions.",
                contacts.size(), actions.size());
        return new ExecuteRequest(contacts, actions);
    }

    /**
     * Reads one candidate object.
     *
     * @throws IOException if {@code rowNumber} is missing or not an integer
     */
    public static CandidateRecord readCandidate(JsonNode node) throws IOException {
        if (node == null || !node.isObject()) {
            throw new IOException("Contact entry must be a JSON object");
        }
        CandidateRecord.Builder builder = CandidateRecord.builder(
                requireInt(node.get("rowNumber"), "contact rowNumber"));

        for (ContactField field : ContactField.values()) {
            JsonNode value = node.get(field.getJsonName());
            if (value != null && !value.isNull()) {
                builder.set(field, value.asText());
            }
        }

        JsonNode raw = node.get("rawFields");
        if (raw != null && raw.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = raw.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                builder.rawField(entry.getKey(),
                        entry.getValue().isNull() ? null : entry.getValue().asText());
            }
        }
        return builder.build();
    }

    private static ImportDecision readDecision(JsonNode node) throws IOException {
        if (node == null || !node.isObject()) {
            throw new IOException("Action entry must be a JSON object");
        }

        ImportAction action;
        try {
            action = ImportAction.fromString(textOrNull(node.get("action")));
        } catch (IllegalArgumentException ex) {
            throw new IOException(ex.getMessage(), ex);
        }

        JsonNode rowNode = node.get("rowNumber");
        if (rowNode == null || rowNode.isNull()) {
            JsonNode parsed = node.get("parsedContact");
            rowNode = parsed == null ? null : parsed.get("rowNumber");
        }
        int rowNumber = requireInt(rowNode, "action rowNumber");

        JsonNode idNode = node.get("existingId");
        if (idNode == null || idNode.isNull()) {
            idNode = node.get("existingContactId");
        }
        Long existingId = null;
        if (idNode != null && !idNode.isNull()) {
            if (!idNode.canConvertToLong() || !idNode.isIntegralNumber()) {
                throw new IOException("existingId must be an integer, got: " + idNode);
            }
            existingId = idNode.asLong();
        }

        return new ImportDecision(rowNumber, action, existingId);
    }

    // -----------------------------------------------------------------------
    // WRITE
    // -----------------------------------------------------------------------

    public static ObjectNode toJson(ImportPreview preview) {
        ObjectNode root = objectMapper.createObjectNode();

        ArrayNode contacts = root.putArray("contacts");
        for (CandidateRecord candidate : preview.getContacts()) {
            contacts.add(toJson(candidate));
        }

        ArrayNode duplicates = root.putArray("duplicates");
        for (DuplicateMatch match : preview.getDuplicates()) {
            duplicates.add(toJson(match));
        }

        ObjectNode validation = root.putObject("validation");
        ArrayNode warnings = validation.putArray("warnings");
        for (ValidationFinding finding : preview.getValidationWarnings()) {
            warnings.addObject()
                    .put("row", finding.getRow())
                    .put("field", finding.getField())
                    .put("message", finding.getMessage())
                    .put("severity", SEVERITY_WARNING);
        }
        validation.putArray("errors");

        root.put("totalRows", preview.getTotalRows());

        ArrayNode parseWarnings = root.putArray("parseWarnings");
        preview.getParseWarnings().forEach(parseWarnings::add);

        ArrayNode parseErrors = root.putArray("parseErrors");
        for (RowError error : preview.getParseErrors()) {
            parseErrors.addObject()
                    .put("row", error.getRow())
                    .put("message", error.getMessage());
        }
        return root;
    }

    public static ObjectNode toJson(CandidateRecord candidate) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("rowNumber", candidate.getRowNumber());
        putFields(node, candidate.getValues());
        ObjectNode raw = node.putObject("rawFields");
        candidate.getRawFields().forEach(raw::put);
        return node;
    }

    public static ObjectNode toJson(Contact contact) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("id", contact.getId());
        node.put("vcardId", contact.getVcardId());
        putFields(node, contact.getFields());
        return node;
    }

    public static ObjectNode toJson(DuplicateMatch match) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("rowNumber", match.getRowNumber());
        node.put("existingId", match.getExistingId());
        node.put("matchType", match.getMatchType().getWireName());
        node.put("confidence", match.getConfidence().getWireName());
        node.put("similarity", match.getSimilarity());
        node.set("parsedContact", toJson(match.getCandidate()));
        node.set("existingContact", toJson(match.getExisting()));
        return node;
    }

    public static ObjectNode toJson(ImportOutcome outcome) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("success", outcome.isSuccess());
        node.put("committed", outcome.isCommitted());
        node.put("created", outcome.getCreated());
        node.put("updated", outcome.getUpdated());
        node.put("skipped", outcome.getSkipped());
        ArrayNode failures = node.putArray("failures");
        for (RowFailure failure : outcome.getFailures()) {
            failures.addObject()
                    .put("rowNumber", failure.getRowNumber())
                    .put("message", failure.getMessage());
        }
        node.put("summary", outcome.getSummary());
        return node;
    }

    public static ObjectNode toJson(ImportRejectedException rejection) {
        return errorBody(rejection.getError(), rejection.getDetails());
    }

    /**
     * @param error   short description
     * @param details supporting lines; omitted from the body when empty
     */
    public static ObjectNode errorBody(String error, List<String> details) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("error", error);
        if (details != null && !details.isEmpty()) {
            ArrayNode array = node.putArray("details");
            details.forEach(array::add);
        }
        return node;
    }

    /**
     * Renders a node as indented JSON text.
     */
    public static String writeString(JsonNode node) throws JsonProcessingException {
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
    }

    // -----------------------------------------------------------------------
    // PRIVATE HELPERS
    // -----------------------------------------------------------------------

    private static void putFields(ObjectNode node, Map<ContactField, String> values) {
        for (ContactField field : ContactField.values()) {
            String value = values.get(field);
            if (value != null) {
                node.put(field.getJsonName(), value);
            }
        }
    }

    private static Iterable<JsonNode> arrayOf(JsonNode root, String name) throws IOException {
        JsonNode node = root.get(name);
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new IOException("'" + name + "' must be a JSON array");
        }
        return node;
    }

    private static int requireInt(JsonNode node, String what) throws IOException {
        if (node == null || !node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new IOException(what + " must be an integer");
        }
        return node.asInt();
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }
}
