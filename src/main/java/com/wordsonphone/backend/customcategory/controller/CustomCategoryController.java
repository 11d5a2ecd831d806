package com.wordsonphone.backend.customcategory.controller;

import com.wordsonphone.backend.customcategory.dto.*;
import com.wordsonphone.backend.customcategory.service.CustomCategoryService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Tag(name = "CustomCategory", description = "Custom category preview/generation, phrase store, quota")
@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/custom-categories")
public class CustomCategoryController {

    private final CustomCategoryService service;

    @GetMapping("/quota")
    public QuotaResponse quota() {
        return service.quota();
    }

    @PostMapping("/samples")
    public SampleWordsResponse samples(@Valid @RequestBody SampleWordsRequest req) {
        return service.requestSampleWords(req.categoryName());
    }

    @PostMapping("/generate")
    public GenerateCategoryResponse generate(@Valid @RequestBody GenerateCategoryRequest req) {
        return service.generateFullCategory(req);
    }

    @PostMapping("/score")
    public ScoreResponse score(@Valid @RequestBody ScoreRequest req) {
        return service.score(req);
    }

    @GetMapping
    public List<String> list() {
        return service.listCategoryNames();
    }

    @GetMapping("/{name}/phrases")
    public List<String> phrases(@PathVariable("name") String name) {
        return service.phrasesFor(name);
    }

    @GetMapping("/requests/{name}")
    public CategoryRequestView request(@PathVariable("name") String name) {
        return service.requestFor(name);
    }

    /** 空類別也回 204 */
    @DeleteMapping("/{name}")
    public ResponseEntity<Void> delete(@PathVariable("name") String name) {
        service.deleteCategory(name);
        return ResponseEntity.noContent().build();
    }
}
