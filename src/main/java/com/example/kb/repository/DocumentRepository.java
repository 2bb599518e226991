package com.example.kb.repository;

import com.example.kb.entity.Document;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

@Repository
public interface DocumentRepository extends JpaRepository<Document, String> {
    List<Document> findByStatusOrderByCreatedAtDesc(Document.DocumentStatus status);
    List<Document> findAllByOrderByCreatedAtDesc();
    List<Document> findByCollectionNameOrderByCreatedAtDesc(String collectionName);
    long countByStatus(Document.DocumentStatus status);

    @Query("SELECT COALESCE(SUM(d.chunkCount), 0) FROM Document d WHERE d.status = :status")
    long sumChunkCountByStatus(@Param("status") Document.DocumentStatus status);

    @Query("SELECT COALESCE(SUM(d.entityCount), 0) FROM Document d WHERE d.status = :status")
    long sumEntityCountByStatus(@Param("status") Document.DocumentStatus status);

    /**
     * 条件更新状态, 返回受影响行数; 只有当前状态在 expected 中时才会更新
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Document d SET d.status = :target, d.updatedAt = :now "
            + "WHERE d.id = :id AND d.status IN :expected")
    int transitionStatus(@Param("id") String id,
                         @Param("expected") Collection<Document.DocumentStatus> expected,
                         @Param("target") Document.DocumentStatus target,
                         @Param("now") LocalDateTime now);

    List<Document> findByStatusIn(Collection<Document.DocumentStatus> statuses);
}
