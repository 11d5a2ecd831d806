package com.wordsonphone.backend.customcategory.repo;

import com.wordsonphone.backend.customcategory.entity.CategoryRequestEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface CategoryRequestRepository extends JpaRepository<CategoryRequestEntity, String> {

    List<CategoryRequestEntity> findByCategoryName(String categoryName);
}
