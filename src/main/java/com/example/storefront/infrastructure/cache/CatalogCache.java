package com.example.storefront.infrastructure.cache;

import com.example.storefront.domain.repository.ProductUnitRepository;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Read-through cache of the catalog's cities, districts and categories, kept in the
 * {@value #CACHE_NAME} cache. Catalog management calls {@link #invalidate()} after every edit.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CatalogCache {

    public static final String CACHE_NAME = "catalog";

    private final ProductUnitRepository productUnitRepository;

    @Cacheable(cacheNames = CACHE_NAME, key = "'all'", sync = true)
    public CatalogView get() {
        SortedMap<String, SortedSet<String>> districtsByCity = new TreeMap<>();
        for (ProductUnitRepository.LocationView location : productUnitRepository.findDistinctLocations()) {
            districtsByCity.computeIfAbsent(location.getCity(), city -> new TreeSet<>()).add(location.getDistrict());
        }
        SortedSet<String> categories = new TreeSet<>(productUnitRepository.findDistinctCategories());

        log.info("Catalog cache loaded: cities={}, categories={}", districtsByCity.size(), categories.size());
        return new CatalogView(districtsByCity, categories);
    }

    @CacheEvict(cacheNames = CACHE_NAME, allEntries = true)
    public void invalidate() {
        log.info("Catalog cache invalidated");
    }

    /**
     * Deeply unmodifiable; the inner district sets are copied too.
     */
    @Value
    public static class CatalogView {
        SortedMap<String, SortedSet<String>> districtsByCity;
        SortedSet<String> categories;

        @JsonCreator
        public CatalogView(@JsonProperty("districtsByCity") SortedMap<String, SortedSet<String>> districtsByCity,
                           @JsonProperty("categories") SortedSet<String> categories) {
            SortedMap<String, SortedSet<String>> copy = new TreeMap<>();
            districtsByCity.forEach((city, districts) ->
                    copy.put(city, Collections.unmodifiableSortedSet(new TreeSet<>(districts))));
            this.districtsByCity = Collections.unmodifiableSortedMap(copy);
            this.categories = Collections.unmodifiableSortedSet(new TreeSet<>(categories));
        }
    }
}
