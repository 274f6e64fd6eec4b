package com.example.storefront.infrastructure.cache;

import com.example.storefront.domain.repository.ProductUnitRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CatalogCacheTest {

    @Mock
    private ProductUnitRepository productUnitRepository;

    private CatalogCache catalogCache;

    @BeforeEach
    void setUp() {
        catalogCache = new CatalogCache(productUnitRepository);
    }

    @Test
    void buildsSortedCitiesDistrictsAndCategories() {
        when(productUnitRepository.findDistinctLocations()).thenReturn(List.of(
                location("Porto", "Ribeira"), location("Lisbon", "Baixa"), location("Lisbon", "Alfama")));
        when(productUnitRepository.findDistinctCategories()).thenReturn(List.of("tea", "coffee"));

        CatalogCache.CatalogView view = catalogCache.get();

        assertEquals(List.of("Lisbon", "Porto"), List.copyOf(view.getDistrictsByCity().keySet()));
        assertEquals(List.of("Alfama", "Baixa"), List.copyOf(view.getDistrictsByCity().get("Lisbon")));
        assertEquals(Set.of("coffee", "tea"), view.getCategories());
    }

    @Test
    void viewCannotBeModified() {
        when(productUnitRepository.findDistinctLocations()).thenReturn(List.of(location("Lisbon", "Alfama")));
        when(productUnitRepository.findDistinctCategories()).thenReturn(List.of("tea"));

        CatalogCache.CatalogView view = catalogCache.get();

        assertThrows(UnsupportedOperationException.class, () -> view.getDistrictsByCity().get("Lisbon").add("Belem"));
        assertThrows(UnsupportedOperationException.class, () -> view.getDistrictsByCity().remove("Lisbon"));
        assertThrows(UnsupportedOperationException.class, () -> view.getCategories().add("coffee"));
    }

    @Test
    void viewIsDetachedFromItsSource() {
        SortedSet<String> districts = new TreeSet<>(Set.of("Alfama"));
        SortedMap<String, SortedSet<String>> byCity = new TreeMap<>();
        byCity.put("Lisbon", districts);
        SortedSet<String> categories = new TreeSet<>(Set.of("tea"));

        CatalogCache.CatalogView view = new CatalogCache.CatalogView(byCity, categories);
        districts.add("Belem");
        byCity.put("Porto", new TreeSet<>());
        categories.add("coffee");

        assertEquals(Set.of("Alfama"), view.getDistrictsByCity().get("Lisbon"));
        assertEquals(Set.of("Lisbon"), view.getDistrictsByCity().keySet());
        assertEquals(Set.of("tea"), view.getCategories());
    }

    private static ProductUnitRepository.LocationView location(String city, String district) {
        return new ProductUnitRepository.LocationView() {
            @Override
            public String getCity() {
                return city;
            }

            @Override
            public String getDistrict() {
                return district;
            }
        };
    }
}
