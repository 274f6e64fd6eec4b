package com.example.storefront.presentation.controller;

import com.example.storefront.infrastructure.cache.CatalogCache;
import com.example.storefront.presentation.dto.response.CatalogResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/catalog")
@RequiredArgsConstructor
public class CatalogController {

    private final CatalogCache catalogCache;

    @GetMapping
    public ResponseEntity<CatalogResponse> getCatalog() {
        return ResponseEntity.ok(CatalogResponse.from(catalogCache.get()));
    }
}
