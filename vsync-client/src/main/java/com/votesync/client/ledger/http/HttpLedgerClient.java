package com.votesync.client.ledger.http;

import com.fasterxml.jackson.core.type.TypeReference;
import com.votesync.client.ledger.LedgerClient;
import com.votesync.client.ledger.VoteLogFilter;
import com.votesync.client.ledger.VotingWeightSource;
import com.votesync.common.constant.VoteSyncConstants;
import com.votesync.common.exception.ErrorCode;
import com.votesync.common.exception.LedgerException;
import com.votesync.common.exception.NotFoundException;
import com.votesync.common.exception.TransientRemoteException;
import com.votesync.common.exception.UnsupportedReadException;
import com.votesync.common.model.AggregateVotes;
import com.votesync.common.model.GovernanceParams;
import com.votesync.common.model.Proposal;
import com.votesync.common.model.ProposalCreationEntry;
import com.votesync.common.model.VoteChoice;
import com.votesync.common.model.VoteReceipt;
import com.votesync.common.model.VoteRecord;
import com.votesync.common.util.JsonUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.math.BigInteger;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;

/**
 * Client for the ledger's JSON-over-HTTP gateway.
 *
 * Status mapping: 404 is {@link NotFoundException}, 501 is {@link UnsupportedReadException},
 * 5xx, I/O errors and timeouts are {@link TransientRemoteException}, other non-2xx answers are a
 * plain {@link LedgerException} carrying the ledger's error message. Bodies that do not parse
 * raise {@link com.votesync.common.exception.DecodeException}.
 */
@Slf4j
public class HttpLedgerClient implements LedgerClient, VotingWeightSource {

    private static final TypeReference<List<VoteRecord>> VOTE_RECORDS = new TypeReference<>() {};
    private static final String CLIENT_ID = "vsync-client";

    private final String ledgerUrl;
    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public HttpLedgerClient(String ledgerUrl) {
        this(ledgerUrl, Duration.ofMillis(VoteSyncConstants.DEFAULT_REQUEST_TIMEOUT_MS));
    }

    public HttpLedgerClient(String ledgerUrl, Duration requestTimeout) {
        this.ledgerUrl = ledgerUrl.endsWith("/") ? ledgerUrl.substring(0, ledgerUrl.length() - 1) : ledgerUrl;
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(requestTimeout)
                .build();

        log.info("HttpLedgerClient initialized with URL: {}", this.ledgerUrl);
    }

    @Override
    public Proposal getProposal(long proposalId) {
        String body = get(LedgerRequestFormatter.proposalUrl(ledgerUrl, proposalId), "proposal " + proposalId);
        return JsonUtils.fromJson(body, Proposal.class);
    }

    @Override
    public AggregateVotes aggregateVotes(long proposalId) {
        String body = get(LedgerRequestFormatter.aggregateUrl(ledgerUrl, proposalId),
                "aggregate votes of proposal " + proposalId);
        return JsonUtils.fromJson(body, AggregateVotes.class);
    }

    @Override
    public BigInteger choiceWeight(long proposalId, VoteChoice choice) {
        String body = get(LedgerRequestFormatter.choiceWeightUrl(ledgerUrl, proposalId, choice),
                choice + " weight of proposal " + proposalId);
        return LedgerRequestFormatter.parseRawField(body, "weight");
    }

    @Override
    public List<VoteRecord> voteLog(VoteLogFilter filter) {
        String body = get(LedgerRequestFormatter.voteLogUrl(ledgerUrl, filter), "vote log");
        return JsonUtils.fromJson(body, VOTE_RECORDS);
    }

    @Override
    public ProposalCreationEntry proposalCreationEntry(long proposalId) {
        String body = get(LedgerRequestFormatter.creationEntryUrl(ledgerUrl, proposalId),
                "creation entry of proposal " + proposalId);
        return JsonUtils.fromJson(body, ProposalCreationEntry.class);
    }

    @Override
    public BigInteger voterWeight(long proposalId, String voterId) {
        String body = get(LedgerRequestFormatter.voterWeightUrl(ledgerUrl, proposalId, voterId),
                "weight of " + voterId + " on proposal " + proposalId);
        return LedgerRequestFormatter.parseRawField(body, "weight");
    }

    @Override
    public GovernanceParams governanceParams() {
        String body = get(LedgerRequestFormatter.governanceParamsUrl(ledgerUrl), "governance params");
        return JsonUtils.fromJson(body, GovernanceParams.class);
    }

    @Override
    public VoteReceipt submitVote(long proposalId, String voterId, VoteChoice choice) {
        log.info("Submitting {} vote of {} on proposal {}", choice, voterId, proposalId);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(LedgerRequestFormatter.submitVoteUrl(ledgerUrl, proposalId)))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .header(VoteSyncConstants.HEADER_CLIENT_ID, CLIENT_ID)
                .POST(HttpRequest.BodyPublishers.ofString(LedgerRequestFormatter.voteRequestBody(voterId, choice)))
                .build();

        String body = send(request, "vote on proposal " + proposalId, ErrorCode.WRITE_FAILED);
        VoteReceipt receipt = JsonUtils.fromJson(body, VoteReceipt.class);

        log.info("✅ Vote committed on proposal {}: tx={}", proposalId, receipt.getTransactionId());
        return receipt;
    }

    @Override
    public BigInteger balanceAt(String holderId, long checkpointId) {
        String body = get(LedgerRequestFormatter.balanceUrl(ledgerUrl, holderId, checkpointId),
                "balance of " + holderId);
        return LedgerRequestFormatter.parseRawField(body, "value");
    }

    @Override
    public String delegateOf(String holderId) {
        String body = get(LedgerRequestFormatter.delegateUrl(ledgerUrl, holderId), "delegate of " + holderId);
        return LedgerRequestFormatter.parseTextField(body, "delegate");
    }

    @Override
    public BigInteger delegatedToAt(String holderId, long checkpointId) {
        String body = get(LedgerRequestFormatter.delegatedUrl(ledgerUrl, holderId, checkpointId),
                "weight delegated to " + holderId);
        return LedgerRequestFormatter.parseRawField(body, "value");
    }

    @Override
    public long currentCheckpoint() {
        String body = get(LedgerRequestFormatter.currentCheckpointUrl(ledgerUrl), "current checkpoint");
        return LedgerRequestFormatter.parseLongField(body, "checkpoint");
    }

    @Override
    public List<String> delegatorsOf(String holderId) {
        String body = get(LedgerRequestFormatter.delegatorsUrl(ledgerUrl, holderId), "delegators of " + holderId);
        return LedgerRequestFormatter.parseTextList(body, "delegators");
    }

    private String get(String url, String what) {
        log.debug("GET {}", url);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(requestTimeout)
                .header("Accept", "application/json")
                .header(VoteSyncConstants.HEADER_CLIENT_ID, CLIENT_ID)
                .GET()
                .build();

        return send(request, what, ErrorCode.READ_FAILED);
    }

    private String send(HttpRequest request, String what, ErrorCode failureCode) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new TransientRemoteException(ErrorCode.NETWORK_TIMEOUT, "Timed out reading " + what, e);
        } catch (ConnectException e) {
            throw new TransientRemoteException(ErrorCode.CONNECTION_FAILED, "Cannot connect to ledger at " + ledgerUrl, e);
        } catch (IOException e) {
            throw new TransientRemoteException(ErrorCode.LEDGER_UNAVAILABLE, "I/O error reading " + what, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientRemoteException(ErrorCode.NETWORK_TIMEOUT, "Interrupted while reading " + what, e);
        }

        int status = response.statusCode();
        log.debug("Response status for {}: {}", what, status);

        if (status >= 200 && status < 300) {
            return response.body();
        }
        if (status == 404) {
            throw new NotFoundException(what);
        }
        if (status == 501) {
            throw new UnsupportedReadException(what);
        }
        if (status >= 500) {
            throw new TransientRemoteException(ErrorCode.SERVICE_UNAVAILABLE, String.format(
                    "Ledger failed on %s. Status: %d, Response: %s", what, status, response.body()));
        }
        throw new LedgerException(failureCode, LedgerRequestFormatter.parseErrorMessage(response.body()));
    }
}
