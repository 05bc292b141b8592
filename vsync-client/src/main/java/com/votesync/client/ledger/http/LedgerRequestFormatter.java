package com.votesync.client.ledger.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.votesync.client.ledger.VoteLogFilter;
import com.votesync.common.exception.DecodeException;
import com.votesync.common.exception.ErrorCode;
import com.votesync.common.util.JsonUtils;
import com.votesync.common.util.UnitScaling;
import com.votesync.common.model.VoteChoice;

import java.math.BigInteger;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Utility class for formatting requests to the ledger's JSON gateway
 */
public class LedgerRequestFormatter {

    private static final String PROPOSALS_ENDPOINT = "/api/v1/ledger/proposals";
    private static final String VOTES_ENDPOINT = "/api/v1/ledger/votes";
    private static final String ACCOUNTS_ENDPOINT = "/api/v1/ledger/accounts";
    private static final String GOVERNANCE_ENDPOINT = "/api/v1/ledger/governance/params";
    private static final String CHECKPOINT_ENDPOINT = "/api/v1/ledger/checkpoints/current";

    public static String proposalUrl(String baseUrl, long proposalId) {
        return baseUrl + PROPOSALS_ENDPOINT + "/" + proposalId;
    }

    public static String aggregateUrl(String baseUrl, long proposalId) {
        return proposalUrl(baseUrl, proposalId) + "/votes/aggregate";
    }

    public static String choiceWeightUrl(String baseUrl, long proposalId, VoteChoice choice) {
        return proposalUrl(baseUrl, proposalId) + "/votes/choices/" + choice.getCode();
    }

    public static String voterWeightUrl(String baseUrl, long proposalId, String voterId) {
        return proposalUrl(baseUrl, proposalId) + "/voters/" + encode(voterId) + "/weight";
    }

    public static String creationEntryUrl(String baseUrl, long proposalId) {
        return proposalUrl(baseUrl, proposalId) + "/creation";
    }

    public static String submitVoteUrl(String baseUrl, long proposalId) {
        return proposalUrl(baseUrl, proposalId) + "/votes";
    }

    public static String governanceParamsUrl(String baseUrl) {
        return baseUrl + GOVERNANCE_ENDPOINT;
    }

    public static String currentCheckpointUrl(String baseUrl) {
        return baseUrl + CHECKPOINT_ENDPOINT;
    }

    /**
     * Build URL for a vote log query, only set filter fields become query parameters
     */
    public static String voteLogUrl(String baseUrl, VoteLogFilter filter) {
        List<String> params = new ArrayList<>();
        if (filter.getProposalId() != null) {
            params.add("proposalId=" + filter.getProposalId());
        }
        if (filter.getVoterId() != null) {
            params.add("voter=" + encode(filter.getVoterId()));
        }
        if (filter.getFromSequence() != null) {
            params.add("fromSequence=" + filter.getFromSequence());
        }
        return params.isEmpty()
                ? baseUrl + VOTES_ENDPOINT
                : baseUrl + VOTES_ENDPOINT + "?" + String.join("&", params);
    }

    public static String balanceUrl(String baseUrl, String holderId, long checkpointId) {
        return baseUrl + ACCOUNTS_ENDPOINT + "/" + encode(holderId) + "/balance?checkpoint=" + checkpointId;
    }

    public static String delegateUrl(String baseUrl, String holderId) {
        return baseUrl + ACCOUNTS_ENDPOINT + "/" + encode(holderId) + "/delegate";
    }

    public static String delegatedUrl(String baseUrl, String holderId, long checkpointId) {
        return baseUrl + ACCOUNTS_ENDPOINT + "/" + encode(holderId) + "/delegated?checkpoint=" + checkpointId;
    }

    public static String delegatorsUrl(String baseUrl, String holderId) {
        return baseUrl + ACCOUNTS_ENDPOINT + "/" + encode(holderId) + "/delegators";
    }

    /**
     * Read a raw integer field such as {"weight": "1000000000000000000"}
     */
    public static BigInteger parseRawField(String json, String field) {
        JsonNode value = requireField(json, field);
        try {
            return UnitScaling.parseRaw(value.asText());
        } catch (NumberFormatException e) {
            throw new DecodeException(ErrorCode.MALFORMED_RESPONSE, "Field '" + field + "' is not an integer", e);
        }
    }

    public static long parseLongField(String json, String field) {
        try {
            return parseRawField(json, field).longValueExact();
        } catch (ArithmeticException e) {
            throw new DecodeException(ErrorCode.MALFORMED_RESPONSE, "Field '" + field + "' out of range", e);
        }
    }

    /**
     * Read a text field, null when absent or JSON null
     */
    public static String parseTextField(String json, String field) {
        JsonNode node = JsonUtils.readTree(json).get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    /**
     * Read an array of text values such as {"delegators": ["0xa", "0xb"]}, empty when absent
     */
    public static List<String> parseTextList(String json, String field) {
        JsonNode node = JsonUtils.readTree(json).get(field);
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new DecodeException("Field '" + field + "' is not an array");
        }
        List<String> values = new ArrayList<>();
        for (JsonNode element : node) {
            if (!element.isNull()) {
                values.add(element.asText());
            }
        }
        return values;
    }

    /**
     * Extract the error message of a failed ledger call, falling back to the raw body
     */
    public static String parseErrorMessage(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        String trimmed = body.trim();
        if (!trimmed.startsWith("{")) {
            return trimmed;
        }
        try {
            JsonNode node = JsonUtils.readTree(trimmed);
            for (String field : new String[]{"reason", "error", "message"}) {
                JsonNode value = node.get(field);
                if (value != null && value.isTextual()) {
                    return value.asText();
                }
            }
            return trimmed;
        } catch (DecodeException e) {
            return trimmed;
        }
    }

    public static String voteRequestBody(String voterId, VoteChoice choice) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("voter", voterId);
        body.put("choice", choice.getCode());
        return JsonUtils.toJson(body);
    }

    private static JsonNode requireField(String json, String field) {
        JsonNode node = JsonUtils.readTree(json);
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new DecodeException("Missing field '" + field + "' in ledger response");
        }
        return value;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
