package com.example.punchsync.client.isapi;

import com.example.punchsync.client.DeviceProtocolException;
import com.example.punchsync.model.RawRecord;
import com.example.punchsync.model.UserRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the JSON (and, for device info, XML) bodies returned by ISAPI terminals.
 */
public class IsapiResponseParser {
    private static final Pattern XML_SERIAL = Pattern.compile("<serialNumber>\\s*([^<]+?)\\s*</serialNumber>");

    private final ObjectMapper mapper = new ObjectMapper();

    public Optional<String> parseSerialNumber(String body) throws DeviceProtocolException {
        if (body == null || body.trim().isEmpty()) {
            throw new DeviceProtocolException("Empty device info response");
        }
        String text = body.trim();
        if (text.startsWith("<")) {
            Matcher matcher = XML_SERIAL.matcher(text);
            return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
        }
        JsonNode root = readTree(text);
        JsonNode info = root.path("DeviceInfo");
        if (info.isMissingNode()) {
            info = root;
        }
        String serial = info.path("serialNumber").asText("");
        return serial.trim().isEmpty() ? Optional.empty() : Optional.of(serial.trim());
    }

    public SearchPage<RawRecord> parseEvents(String json) throws DeviceProtocolException {
        JsonNode root = readTree(json);
        failOnErrorStatus(root);
        JsonNode result = firstPresent(root, "AcsEvent", "acsEvent");
        List<RawRecord> records = new ArrayList<>();
        JsonNode infoList = firstPresent(result, "InfoList", "infoList");
        for (JsonNode node : asList(infoList)) {
            RawRecord record = new RawRecord(toAttributes(node));
            // door, alarm and tamper events carry no person
            if (record.getUserId().isPresent()) {
                records.add(record);
            }
        }
        return new SearchPage<>(records,
            result.path("totalMatches").asInt(-1),
            result.path("numOfMatches").asInt(asList(infoList).size()),
            textOrNull(result.path("responseStatusStrg")));
    }

    public SearchPage<UserRecord> parseUsers(String json, Instant seenAt) throws DeviceProtocolException {
        JsonNode root = readTree(json);
        failOnErrorStatus(root);
        JsonNode result = firstPresent(root, "UserInfoSearch", "userInfoSearch");
        List<UserRecord> users = new ArrayList<>();
        JsonNode userInfo = firstPresent(result, "UserInfo", "userInfo");
        for (JsonNode node : asList(userInfo)) {
            String userId = textOrNull(node.path("employeeNo"));
            if (userId == null) {
                continue;
            }
            users.add(new UserRecord(userId, textOrNull(node.path("name")), seenAt));
        }
        return new SearchPage<>(users,
            result.path("totalMatches").asInt(-1),
            result.path("numOfMatches").asInt(asList(userInfo).size()),
            textOrNull(result.path("responseStatusStrg")));
    }

    private JsonNode readTree(String json) throws DeviceProtocolException {
        if (json == null || json.trim().isEmpty()) {
            throw new DeviceProtocolException("Empty response body");
        }
        try {
            JsonNode root = mapper.readTree(json);
            return root == null ? MissingNode.getInstance() : root;
        } catch (JsonProcessingException ex) {
            throw new DeviceProtocolException("Malformed JSON response", ex);
        }
    }

    private void failOnErrorStatus(JsonNode root) throws DeviceProtocolException {
        JsonNode statusCode = root.path("statusCode");
        if (statusCode.isMissingNode() || statusCode.asInt(1) == 1) {
            return;
        }
        String detail = Optional.ofNullable(textOrNull(root.path("subStatusCode")))
            .orElse(Optional.ofNullable(textOrNull(root.path("statusString"))).orElse("unknown"));
        throw new DeviceProtocolException("Device rejected request: statusCode=" + statusCode.asText() + " (" + detail + ")");
    }

    private JsonNode firstPresent(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.path(field);
            if (!value.isMissingNode() && !value.isNull()) {
                return value;
            }
        }
        return MissingNode.getInstance();
    }

    private List<JsonNode> asList(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return Collections.emptyList();
        }
        List<JsonNode> result = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(result::add);
        } else if (node.isObject()) {
            result.add(node);
        }
        return result;
    }

    private Map<String, String> toAttributes(JsonNode node) {
        Map<String, String> attributes = new LinkedHashMap<>();
        node.fieldNames().forEachRemaining(field -> {
            JsonNode value = node.get(field);
            if (value.isValueNode()) {
                attributes.put(field, value.asText());
            } else {
                attributes.put(field, value.toString());
            }
        });
        return attributes;
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        String text = node.asText();
        return text.trim().isEmpty() ? null : text.trim();
    }

    /**
     * One page of an ISAPI search.
     */
    public static final class SearchPage<T> {
        private final List<T> items;
        private final int totalMatches;
        private final int numMatches;
        private final String status;

        SearchPage(List<T> items, int totalMatches, int numMatches, String status) {
            this.items = Collections.unmodifiableList(items);
            this.totalMatches = totalMatches;
            this.numMatches = Math.max(numMatches, 0);
            this.status = status;
        }

        public List<T> getItems() {
            return items;
        }

        public int getTotalMatches() {
            return totalMatches;
        }

        /**
         * Number of entries the device returned, including those the parser skipped.
         */
        public int getNumMatches() {
            return numMatches;
        }

        public String getStatus() {
            return status;
        }

        public boolean hasMore() {
            return PaginationPlanner.STATUS_MORE.equalsIgnoreCase(status == null ? "" : status.trim());
        }
    }
}
