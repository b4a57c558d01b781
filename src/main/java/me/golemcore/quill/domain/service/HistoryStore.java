package me.golemcore.quill.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.quill.domain.model.HistorySnapshot;
import me.golemcore.quill.domain.model.Message;
import me.golemcore.quill.domain.model.TokenUsage;
import me.golemcore.quill.domain.model.TruncationResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Token-bounded conversation memory with a proposal/commit/discard workflow.
 *
 * <p>
 * The store is either <b>clean</b> (only the committed sequence exists) or
 * <b>proposed</b> (a divergent proposal sequence exists on top of it):
 * <ul>
 * <li>{@link #addMessage(Message)} always writes to the proposal, forking it
 * from the committed sequence first when the store is clean.</li>
 * <li>{@link #prepareForResponse()} freezes whatever is active as the new
 * committed baseline right before a model call.</li>
 * <li>{@link #commitProposal()} promotes the proposal; {@link #discardProposal()}
 * drops it and reverts to the last commit.</li>
 * </ul>
 *
 * <p>
 * The active sequence never exceeds {@link #getMaxTokens()} unless its newest
 * message alone is larger, which is reported through
 * {@link #getLastTruncation()}. Committed and proposal sequences are separate
 * lists, and every accessor returns an unmodifiable copy, so callers can keep
 * a snapshot while the store moves on.
 *
 * <p>
 * All operations synchronize on the store, so a model call completing on
 * another thread may append while the UI thread commits or discards.
 */
@Slf4j
public class HistoryStore {

    private final TruncationPolicy truncationPolicy;

    private List<Message> committed = new ArrayList<>();
    private List<Message> proposal;
    private boolean pendingProposal = false;
    private int maxTokens;
    private TruncationResult lastTruncation = TruncationResult.empty();

    public HistoryStore(TruncationPolicy truncationPolicy, int maxTokens) {
        TruncationPolicy.requireValidBudget(maxTokens);
        this.truncationPolicy = Objects.requireNonNull(truncationPolicy, "truncationPolicy");
        this.maxTokens = maxTokens;
    }

    // ==================== STATE TRANSITIONS ====================

    /**
     * Appends a message to the proposal, starting one from the committed state
     * if none is pending.
     */
    public synchronized void addMessage(Message message) {
        Objects.requireNonNull(message, "message");
        ensureProposal();
        proposal.add(message);
        proposal = applyBudget(proposal);
    }

    /**
     * Appends several messages to the proposal and truncates once.
     */
    public synchronized void addMessages(List<Message> messages) {
        if (messages == null || messages.isEmpty()) {
            return;
        }
        ensureProposal();
        for (Message message : messages) {
            proposal.add(Objects.requireNonNull(message, "message"));
        }
        proposal = applyBudget(proposal);
    }

    /**
     * Makes the active sequence, i.e. what is about to be sent to the model,
     * the committed baseline.
     */
    public synchronized void prepareForResponse() {
        committed = new ArrayList<>(activeList());
        proposal = null;
        pendingProposal = false;
        log.debug("[History] Prepared for response, {} committed messages", committed.size());
    }

    /**
     * Promotes the pending proposal to committed. No-op when nothing is pending.
     */
    public synchronized void commitProposal() {
        if (!pendingProposal) {
            log.debug("[History] Commit requested without pending proposal, ignoring");
            return;
        }
        committed = new ArrayList<>(proposal);
        proposal = null;
        pendingProposal = false;
        log.debug("[History] Committed proposal, {} messages", committed.size());
    }

    /**
     * Drops the pending proposal; the committed sequence is left as it was.
     */
    public synchronized void discardProposal() {
        if (!pendingProposal) {
            log.debug("[History] Discard requested without pending proposal, ignoring");
            return;
        }
        int discarded = proposal.size();
        proposal = null;
        pendingProposal = false;
        // committed may predate a budget reduction made while the proposal was active
        committed = applyBudget(committed);
        log.debug("[History] Discarded proposal of {} messages, reverted to {} committed",
                discarded, committed.size());
    }

    /**
     * Replaces the committed sequence (bounded to the budget) and clears any
     * proposal.
     */
    public synchronized void reset(List<Message> messages) {
        proposal = null;
        pendingProposal = false;
        committed = applyBudget(new ArrayList<>(Message.copyOf(messages)));
        log.debug("[History] Reset to {} messages", committed.size());
    }

    /**
     * Clears all messages.
     */
    public synchronized void clear() {
        reset(List.of());
    }

    /**
     * Replaces the newest proposal message with an edited assistant message.
     * Only applies while a proposal is pending and ends with an assistant turn.
     *
     * @return {@code true} if the proposal was changed
     */
    public synchronized boolean replaceLastMessage(Message replacement) {
        Objects.requireNonNull(replacement, "replacement");
        if (!pendingProposal || proposal.isEmpty()) {
            log.debug("[History] No pending proposal to edit");
            return false;
        }
        int last = proposal.size() - 1;
        if (!proposal.get(last).isAssistantMessage() || !replacement.isAssistantMessage()) {
            log.debug("[History] Newest proposal message is not an assistant turn, edit ignored");
            return false;
        }
        proposal.set(last, replacement);
        proposal = applyBudget(proposal);
        return true;
    }

    /**
     * Changes the budget and re-truncates the active sequence immediately.
     *
     * @throws TruncationPolicy.InvalidBudgetException
     *             if {@code newMaxTokens < 1}; the previous budget is kept
     */
    public synchronized void setMaxTokens(int newMaxTokens) {
        TruncationPolicy.requireValidBudget(newMaxTokens);
        this.maxTokens = newMaxTokens;
        if (pendingProposal) {
            proposal = applyBudget(proposal);
        } else {
            committed = applyBudget(committed);
        }
        log.debug("[History] Budget changed to {} tokens", newMaxTokens);
    }

    // ==================== READ ACCESS ====================

    /**
     * Messages the model should see next: the proposal when pending, otherwise
     * the committed sequence.
     */
    public synchronized List<Message> activeSequence() {
        return List.copyOf(activeList());
    }

    public synchronized List<Message> committedSequence() {
        return List.copyOf(committed);
    }

    public synchronized boolean hasPendingProposal() {
        return pendingProposal;
    }

    public synchronized int getMaxTokens() {
        return maxTokens;
    }

    /**
     * Outcome of the most recent budget application, including the over-budget
     * warning flag.
     */
    public synchronized TruncationResult getLastTruncation() {
        return lastTruncation;
    }

    public synchronized TokenUsage getTokenUsage() {
        List<Message> active = activeList();
        return TokenUsage.builder()
                .usedTokens(truncationPolicy.countTokens(active))
                .maxTokens(maxTokens)
                .messageCount(active.size())
                .pendingProposal(pendingProposal)
                .overBudget(lastTruncation.overBudget())
                .build();
    }

    public synchronized HistorySnapshot snapshot() {
        return HistorySnapshot.builder()
                .maxTokens(maxTokens)
                .committed(List.copyOf(committed))
                .proposal(pendingProposal ? List.copyOf(proposal) : null)
                .hasPendingProposal(pendingProposal)
                .build();
    }

    /**
     * Loads a snapshot into this store, re-applying the current budget to the
     * restored sequences.
     */
    synchronized void restore(HistorySnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        committed = new ArrayList<>(Message.copyOf(snapshot.committed()));
        if (snapshot.hasPendingProposal() && snapshot.proposal() != null) {
            proposal = applyBudget(new ArrayList<>(Message.copyOf(snapshot.proposal())));
            pendingProposal = true;
            committed = new ArrayList<>(truncationPolicy.truncate(committed, maxTokens).messages());
        } else {
            proposal = null;
            pendingProposal = false;
            committed = applyBudget(committed);
        }
    }

    // ==================== INTERNALS ====================

    private void ensureProposal() {
        if (!pendingProposal) {
            proposal = new ArrayList<>(committed);
            pendingProposal = true;
        }
    }

    private List<Message> activeList() {
        return pendingProposal ? proposal : committed;
    }

    private List<Message> applyBudget(List<Message> messages) {
        TruncationResult result = truncationPolicy.truncate(messages, maxTokens);
        lastTruncation = result;
        if (result.droppedCount() > 0) {
            log.debug("[History] Truncated {} oldest messages ({} tokens kept of {})",
                    result.droppedCount(), result.tokenCount(), maxTokens);
        }
        return new ArrayList<>(result.messages());
    }
}
