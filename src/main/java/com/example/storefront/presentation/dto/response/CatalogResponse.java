package com.example.storefront.presentation.dto.response;

import com.example.storefront.infrastructure.cache.CatalogCache;
import com.example.storefront.presentation.dto.common.BaseResponse;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.util.Map;
import java.util.SortedSet;

@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class CatalogResponse extends BaseResponse {

    private Map<String, SortedSet<String>> districtsByCity;
    private SortedSet<String> categories;

    public static CatalogResponse from(CatalogCache.CatalogView view) {
        return CatalogResponse.builder()
                .status("SUCCESS")
                .districtsByCity(view.getDistrictsByCity())
                .categories(view.getCategories())
                .build();
    }
}
