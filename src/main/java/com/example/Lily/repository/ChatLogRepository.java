package com.example.Lily.repository;

import com.example.Lily.model.ChatLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ChatLogRepository extends JpaRepository<ChatLog, Long> {

    List<ChatLog> findBySessionIdOrderByIdAsc(String sessionId);
}
