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
import me.golemcore.quill.domain.model.LlmRequest;
import me.golemcore.quill.domain.model.LlmResponse;
import me.golemcore.quill.domain.model.Message;
import me.golemcore.quill.domain.model.ParsedResponse;
import me.golemcore.quill.domain.model.StorySession;
import me.golemcore.quill.domain.model.TokenUsage;
import me.golemcore.quill.infrastructure.config.QuillProperties;
import me.golemcore.quill.port.outbound.LlmPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Story writing workflow driven by the UI: generating proposals ("blue text"),
 * committing them to canon, discarding or editing them, and starting or
 * loading stories.
 *
 * <p>
 * Model calls never block the caller. Each call is sent with a private copy of
 * the active history taken when the call starts, and the store is frozen with
 * {@link HistoryStore#prepareForResponse()} at the same moment. Commits,
 * discards or edits arriving while the call is outstanding apply to the store;
 * the answer is appended to the same store when it arrives. A failed, timed
 * out or cancelled call leaves the store as it was.
 */
@Service
@Slf4j
public class StoryService {

    private final LlmPort llmPort;
    private final HistorySimulator historySimulator;
    private final CanonSegmenter canonSegmenter;
    private final ResponseParser responseParser;
    private final SystemPromptService systemPromptService;
    private final QuillProperties properties;
    private final Clock clock;

    private final Object lock = new Object();
    private final StorySession session;
    private CompletableFuture<ParsedResponse> inFlight;

    public StoryService(LlmPort llmPort, HistoryStoreFactory historyStoreFactory, HistorySimulator historySimulator,
            CanonSegmenter canonSegmenter, ResponseParser responseParser, SystemPromptService systemPromptService,
            QuillProperties properties, Clock clock) {
        this.llmPort = llmPort;
        this.historySimulator = historySimulator;
        this.canonSegmenter = canonSegmenter;
        this.responseParser = responseParser;
        this.systemPromptService = systemPromptService;
        this.properties = properties;
        this.clock = clock;
        this.session = new StorySession(historyStoreFactory.create());
    }

    // ==================== STORY LIFECYCLE ====================

    /**
     * Clears canon, proposal and conversation memory. An outstanding model call
     * is abandoned.
     */
    public void newStory() {
        synchronized (lock) {
            resetLocked();
        }
        log.info("[Story] New story started");
    }

    /**
     * Replaces the current story with loaded text. Every chunk becomes canon;
     * conversation memory is simulated from the last
     * {@code quill.memory.simulation-chunks} chunks.
     *
     * @return number of canon chunks loaded
     */
    public int loadStory(String fileName, String text) {
        List<String> chunks = canonSegmenter.segment(text);
        List<Message> simulated = historySimulator.simulate(chunks, properties.getMemory().getSimulationChunks());
        synchronized (lock) {
            resetLocked();
            session.setFileName(fileName);
            session.getCanon().addAll(chunks);
            session.getHistory().reset(simulated);
        }
        log.info("[Story] Loaded {} canon chunks from {}", chunks.size(), fileName);
        return chunks.size();
    }

    /**
     * Canon text as it should be written to the story file.
     */
    public String exportCanon() {
        synchronized (lock) {
            return canonSegmenter.join(List.copyOf(session.getCanon()));
        }
    }

    // ==================== GENERATION ====================

    /**
     * Commits pending blue text, then asks the model to continue.
     */
    public CompletableFuture<ParsedResponse> continueStory(String guidance) {
        return startGeneration(guidance, properties.getGeneration().getXmlTag(), false);
    }

    /**
     * Discards pending blue text, then asks the model for a new attempt.
     */
    public CompletableFuture<ParsedResponse> rewrite(String guidance) {
        return startGeneration(guidance, properties.getGeneration().getXmlTag(), true);
    }

    /**
     * Sends the active history plus the guidance to the model. Pending blue text
     * is committed first, since the history sent to the model becomes the new
     * baseline.
     *
     * @param guidance
     *            user instruction; blank falls back to
     *            {@code quill.generation.default-guidance}
     * @param xmlTag
     *            optional tag (e.g. {@code <instruction>}) to wrap the guidance in
     * @throws GenerationInProgressException
     *             if a previous call has not completed; nothing is changed
     */
    public CompletableFuture<ParsedResponse> generate(String guidance, String xmlTag) {
        return startGeneration(guidance, xmlTag, false);
    }

    private CompletableFuture<ParsedResponse> startGeneration(String guidance, String xmlTag,
            boolean discardPending) {
        String userTurn = buildUserTurn(guidance, xmlTag);
        HistoryStore history = session.getHistory();
        CompletableFuture<ParsedResponse> result = new CompletableFuture<>();
        List<Message> snapshot;
        synchronized (lock) {
            if (inFlight != null && !inFlight.isDone()) {
                throw new GenerationInProgressException();
            }
            if (discardPending) {
                discardLocked();
            } else if (session.hasProposal()) {
                commitLocked();
            }
            snapshot = history.activeSequence();
            history.prepareForResponse();
            inFlight = result;
        }

        List<Message> requestMessages = new ArrayList<>(snapshot);
        requestMessages.add(Message.user(userTurn));
        QuillProperties.GenerationProperties generation = properties.getGeneration();
        LlmRequest request = LlmRequest.builder()
                .model(generation.getModel())
                .systemPrompt(systemPromptService.getActivePromptContent())
                .messages(requestMessages)
                .temperature(generation.getTemperature())
                .maxTokens(generation.getMaxResponseTokens())
                .build();

        long start = clock.millis();
        log.info("[Story] Invoking {} with {} history messages", llmPort.getProviderId(), snapshot.size());

        CompletableFuture<LlmResponse> call;
        try {
            call = llmPort.chat(request).orTimeout(generation.getTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (RuntimeException e) {
            log.warn("[Story] LLM invocation failed: {}", e.getMessage());
            result.completeExceptionally(e);
            return result;
        }

        result.whenComplete((parsed, error) -> {
            if (result.isCancelled()) {
                call.cancel(true);
            }
        });
        call.whenComplete((response, error) -> {
            if (error != null) {
                log.warn("[Story] LLM invocation failed: {}", error.getMessage());
                result.completeExceptionally(error);
                return;
            }
            ParsedResponse parsed;
            try {
                parsed = acceptResponse(result, history, userTurn, response);
            } catch (RuntimeException e) {
                log.warn("[Story] Failed to apply LLM response: {}", e.getMessage());
                result.completeExceptionally(e);
                return;
            }
            if (parsed == null) {
                log.info("[Story] Response arrived after cancellation, history left untouched");
                return;
            }
            log.info("[Story] Generated {} chars in {}ms", parsed.narrative().length(), clock.millis() - start);
            result.complete(parsed);
        });
        return result;
    }

    /**
     * Abandons the outstanding model call, if any. The history is not touched.
     *
     * @return {@code true} if a call was cancelled
     */
    public boolean cancelGeneration() {
        synchronized (lock) {
            return cancelLocked();
        }
    }

    public boolean isGenerating() {
        synchronized (lock) {
            return inFlight != null && !inFlight.isDone();
        }
    }

    // ==================== PROPOSAL HANDLING ====================

    /**
     * Appends the blue text to canon and commits the conversation proposal.
     *
     * @return {@code false} if there was no blue text
     */
    public boolean commit() {
        synchronized (lock) {
            if (!session.hasProposal()) {
                log.debug("[Story] Commit skipped: no proposal");
                return false;
            }
            commitLocked();
            return true;
        }
    }

    /**
     * Drops the blue text and reverts conversation memory to the last commit.
     */
    public void discard() {
        synchronized (lock) {
            discardLocked();
        }
    }

    /**
     * Replaces the blue text with a user edit. The edited text also replaces the
     * model's answer in the pending history, so the model sees the edit next.
     * Erasing the blue text discards the proposal.
     *
     * @return {@code false} if there was no model answer to edit; nothing is
     *         changed then
     */
    public boolean editProposal(String text) {
        String edited = text != null ? text : "";
        synchronized (lock) {
            if (!session.hasProposal()) {
                log.debug("[Story] Edit ignored: no proposal");
                return false;
            }
            if (edited.isEmpty()) {
                discardLocked();
                log.info("[Story] Blue text erased, proposal discarded");
                return true;
            }
            if (!session.getHistory().replaceLastMessage(Message.assistant(edited))) {
                log.warn("[Story] Edit ignored: history has no pending model answer");
                return false;
            }
            session.setProposalNarrative(edited);
            return true;
        }
    }

    // ==================== SETTINGS & READ ACCESS ====================

    /**
     * @throws TruncationPolicy.InvalidBudgetException
     *             if {@code maxTokens < 1}; the previous budget stays in effect
     */
    public void setMaxTokens(int maxTokens) {
        session.getHistory().setMaxTokens(maxTokens);
    }

    public TokenUsage getTokenUsage() {
        return session.getHistory().getTokenUsage();
    }

    public List<Message> getActiveMessages() {
        return session.getHistory().activeSequence();
    }

    public HistoryStore getHistory() {
        return session.getHistory();
    }

    public List<String> getCanon() {
        synchronized (lock) {
            return List.copyOf(session.getCanon());
        }
    }

    public String getProposalNarrative() {
        synchronized (lock) {
            return session.getProposalNarrative();
        }
    }

    public String getThinking() {
        synchronized (lock) {
            return session.getThinking();
        }
    }

    public String getFileName() {
        synchronized (lock) {
            return session.getFileName();
        }
    }

    // ==================== INTERNALS ====================

    private ParsedResponse acceptResponse(CompletableFuture<ParsedResponse> result, HistoryStore history,
            String userTurn, LlmResponse response) {
        synchronized (lock) {
            if (result.isCancelled()) {
                return null;
            }
            ParsedResponse parsed = responseParser.parse(response != null ? response.getContent() : null);
            history.addMessage(Message.user(userTurn));
            history.addMessage(Message.assistant(parsed.narrative()));
            session.setProposalNarrative(parsed.narrative());
            session.setThinking(parsed.thinking());
            return parsed;
        }
    }

    private void commitLocked() {
        session.getCanon().add(session.getProposalNarrative());
        session.getHistory().commitProposal();
        session.clearProposal();
        log.info("[Story] Committed proposal, canon has {} chunks", session.getCanon().size());
    }

    private void discardLocked() {
        session.getHistory().discardProposal();
        session.clearProposal();
    }

    private void resetLocked() {
        cancelLocked();
        session.getCanon().clear();
        session.clearProposal();
        session.setFileName(null);
        session.getHistory().clear();
    }

    private boolean cancelLocked() {
        if (inFlight == null || inFlight.isDone()) {
            return false;
        }
        boolean cancelled = inFlight.cancel(true);
        log.info("[Story] Generation cancelled (cancelled={})", cancelled);
        return cancelled;
    }

    private String buildUserTurn(String guidance, String xmlTag) {
        String text = guidance == null || guidance.isBlank()
                ? properties.getGeneration().getDefaultGuidance()
                : guidance.strip();
        if (xmlTag == null || xmlTag.isBlank()) {
            return text;
        }
        String tagName = xmlTag.replace("<", "").replace(">", "").replace("/", "").strip().split("\\s+")[0];
        if (tagName.isEmpty()) {
            return text;
        }
        return "<" + tagName + ">" + text + "</" + tagName + ">";
    }

    /**
     * Raised when a generation is requested while another one is outstanding.
     */
    public static final class GenerationInProgressException extends IllegalStateException {

        public GenerationInProgressException() {
            super("A generation is already in progress");
        }
    }
}
