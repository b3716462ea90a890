package com.example.documents.infrastructure.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

/**
 * Spring Data access to the {@code documents} table.
 */
public interface DocumentEntityRepository extends JpaRepository<DocumentEntity, Long> {

    List<DocumentEntity> findAllByOrderByCreatedAtDescIdDesc();

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from DocumentEntity d where d.id = :id")
    int deleteRowById(@Param("id") Long id);
}
