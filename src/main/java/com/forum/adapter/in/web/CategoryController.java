package com.forum.adapter.in.web;

import com.forum.application.port.in.ListCategoriesUseCase;
import com.forum.domain.model.DiscussionCategory;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Categories", description = "Discussion categories")
public class CategoryController {

    private final ListCategoriesUseCase listCategoriesUseCase;

    public CategoryController(ListCategoriesUseCase listCategoriesUseCase) {
        this.listCategoriesUseCase = listCategoriesUseCase;
    }

    @GetMapping("/discussion-categories")
    @Operation(summary = "List discussion categories", description = "Keys accepted by the category filter")
    public ResponseEntity<List<CategoryResponse>> listCategories() {
        return ResponseEntity.ok(listCategoriesUseCase.listCategories().stream()
            .map(CategoryResponse::from)
            .toList());
    }

    public record CategoryResponse(String key, boolean nonScript) {
        public static CategoryResponse from(DiscussionCategory category) {
            return new CategoryResponse(category.categoryKey(), category.nonScript());
        }
    }
}
