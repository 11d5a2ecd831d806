package com.wordsonphone.backend.customcategory.repo;

import com.wordsonphone.backend.customcategory.entity.GeneratedPhraseEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface GeneratedPhraseRepository extends JpaRepository<GeneratedPhraseEntity, String> {

    List<GeneratedPhraseEntity> findAllByOrderByCreatedAtUtcAsc();

    @Query("""
        SELECT p.text FROM GeneratedPhraseEntity p
        WHERE p.customCategory = :category
        ORDER BY p.createdAtUtc ASC, p.qualityScore DESC
        """)
    List<String> findTextsByCategory(@Param("category") String category);

    @Query("SELECT p.textKey FROM GeneratedPhraseEntity p")
    List<String> findAllTextKeys();

    @Query("SELECT p.textKey FROM GeneratedPhraseEntity p WHERE p.textKey IN :keys")
    List<String> findExistingTextKeys(@Param("keys") Collection<String> keys);

    @Query("SELECT DISTINCT p.customCategory FROM GeneratedPhraseEntity p ORDER BY p.customCategory")
    List<String> findDistinctCategories();

    long countByCustomCategory(String customCategory);

    @Modifying
    @Query("DELETE FROM GeneratedPhraseEntity p WHERE p.customCategory = :category")
    int deleteByCategory(@Param("category") String category);
}
