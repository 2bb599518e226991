package com.example.kb.repository;

import com.example.kb.entity.DocumentText;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface DocumentTextRepository extends JpaRepository<DocumentText, String> {
}
