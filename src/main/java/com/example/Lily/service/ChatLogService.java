package com.example.Lily.service;

import com.example.Lily.model.ChatLog;
import com.example.Lily.model.ToolResult;
import com.example.Lily.model.TurnOutcome;
import com.example.Lily.repository.ChatLogRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class ChatLogService {

    private static final Logger log = LoggerFactory.getLogger(ChatLogService.class);

    private final ChatLogRepository chatLogRepository;
    private final ObjectMapper objectMapper;

    /**
     * Persist an audit row for a committed turn. Storage problems are logged, never propagated:
     * the answer is already committed to the conversation.
     */
    public void recordTurn(TurnOutcome outcome, String model) {
        ChatLog chatLog = new ChatLog();
        chatLog.setSessionId(outcome.sessionId());
        chatLog.setModel(model);
        chatLog.setQuestion(outcome.question());
        chatLog.setPrompt(outcome.prompt());
        chatLog.setAnswer(outcome.answer());
        chatLog.setEvidenceJson(serializeEvidence(outcome.evidence()));
        chatLog.setRounds(outcome.rounds());
        chatLog.setCommitReason(outcome.commitReason());
        chatLog.setAnalysisFallback(outcome.analysis() != null && outcome.analysis().fallback());

        try {
            chatLogRepository.save(chatLog);
        } catch (DataAccessException e) {
            log.warn("Failed to record chat log for session {}: {}", outcome.sessionId(), e.getMessage());
        }
    }

    /**
     * Audit rows of one session, oldest first.
     */
    public List<ChatLog> turnsOf(String sessionId) {
        return chatLogRepository.findBySessionIdOrderByIdAsc(sessionId);
    }

    private String serializeEvidence(List<ToolResult> evidence) {
        if (evidence == null || evidence.isEmpty()) {
            return "[]";
        }
        try {
            return objectMapper.writeValueAsString(evidence);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize evidence for chat log", e);
            return "[]";
        }
    }
}
