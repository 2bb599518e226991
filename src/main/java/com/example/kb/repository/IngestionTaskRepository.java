package com.example.kb.repository;

import com.example.kb.entity.IngestionTask;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Repository
public interface IngestionTaskRepository extends JpaRepository<IngestionTask, String> {
    Optional<IngestionTask> findFirstByDocumentIdAndSupersededFalseOrderByCreatedAtDesc(String documentId);
    List<IngestionTask> findByDocumentIdOrderByCreatedAtDesc(String documentId);
    List<IngestionTask> findBySupersededFalseAndStatusIn(List<IngestionTask.TaskStatus> statuses);

    @Transactional
    void deleteByDocumentId(String documentId);
}
