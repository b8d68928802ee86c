package fun.fengwk.discovery.core.facade.search.catalog;

import fun.fengwk.discovery.core.exception.StorageUnavailableException;
import fun.fengwk.discovery.core.facade.search.model.BusinessLocation;
import fun.fengwk.discovery.core.facade.search.model.BusinessResult;
import fun.fengwk.discovery.core.facade.search.model.BusinessSource;
import fun.fengwk.discovery.core.facade.search.model.CategorySummary;
import fun.fengwk.discovery.core.facade.search.model.SearchQuery;
import fun.fengwk.discovery.core.geo.GeoMath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
@ExtendWith(MockitoExtension.class)
class LocalCatalogSearchTest {

    @Mock
    private CatalogReader catalogReader;

    private LocalCatalogSearch localCatalogSearch;

    @BeforeEach
    void setUp() {
        localCatalogSearch = new LocalCatalogSearch(catalogReader);
    }

    @Test
    void shouldPassFiltersToReader() {
        when(catalogReader.findBusinesses(any())).thenReturn(List.of());

        localCatalogSearch.search(SearchQuery.builder()
            .query("  pizza ")
            .categoryIds(List.of("pizza", "pizza", "italian"))
            .rating(4.0)
            .build());

        ArgumentCaptor<CatalogQuery> captor = ArgumentCaptor.forClass(CatalogQuery.class);
        verify(catalogReader).findBusinesses(captor.capture());
        CatalogQuery catalogQuery = captor.getValue();
        assertThat(catalogQuery.getText()).isEqualTo("pizza");
        assertThat(catalogQuery.getCategoryIds()).containsExactly("pizza", "italian");
        assertThat(catalogQuery.getMinRating()).isEqualTo(4.0);
        assertThat(catalogQuery.getBoundingBox()).isNull();
    }

    @Test
    void shouldPassBoundingBoxWhenLocationGiven() {
        when(catalogReader.findBusinesses(any())).thenReturn(List.of());

        localCatalogSearch.search(SearchQuery.builder()
            .query("pizza")
            .latitude(40.7128)
            .longitude(-74.0060)
            .radiusMeters(1000)
            .build());

        ArgumentCaptor<CatalogQuery> captor = ArgumentCaptor.forClass(CatalogQuery.class);
        verify(catalogReader).findBusinesses(captor.capture());
        GeoMath.BoundingBox box = captor.getValue().getBoundingBox();
        assertThat(box).isNotNull();
        assertThat(box.minLatitude()).isLessThan(40.7128);
        assertThat(box.maxLatitude()).isGreaterThan(40.7128);
        assertThat(box.minLongitude()).isLessThan(-74.0060);
        assertThat(box.maxLongitude()).isGreaterThan(-74.0060);
    }

    @Test
    void shouldApplyRatingFloorToRoundedRating() {
        when(catalogReader.findBusinesses(any())).thenReturn(List.of(
            CatalogBusinessRecord.builder().id("shown-4.0").name("A").ratingSum(7.9).ratingCount(2).build(),
            CatalogBusinessRecord.builder().id("shown-3.9").name("B").ratingSum(7.8).ratingCount(2).build(),
            CatalogBusinessRecord.builder().id("unrated").name("C").build()));

        List<BusinessResult> results = localCatalogSearch.search(SearchQuery.builder()
            .query("place")
            .rating(4.0)
            .build());

        assertThat(results).extracting(BusinessResult::getId).containsExactly("shown-4.0");
        assertThat(results.get(0).getRating()).isEqualTo(4.0);
    }

    @Test
    void shouldMapRecordsWithRoundedRating() {
        when(catalogReader.findBusinesses(any())).thenReturn(List.of(
            CatalogBusinessRecord.builder()
                .id("biz-1")
                .name("Tony's Pizza")
                .username("tonys")
                .ratingSum(10)
                .ratingCount(3)
                .categories(List.of(new CategorySummary("pizza", "Pizza")))
                .locations(List.of(location("loc-1", 40.7128, -74.0060)))
                .build(),
            CatalogBusinessRecord.builder()
                .id("biz-2")
                .name("New Place")
                .build()));

        List<BusinessResult> results = localCatalogSearch.search(SearchQuery.builder().query("pizza").build());

        assertThat(results).hasSize(2);
        BusinessResult first = results.get(0);
        assertThat(first.getSource()).isEqualTo(BusinessSource.LOCAL);
        assertThat(first.getRating()).isEqualTo(3.3);
        assertThat(first.getRatingCount()).isEqualTo(3);
        assertThat(first.getUsername()).isEqualTo("tonys");
        assertThat(first.getDistanceMeters()).isNull();
        assertThat(first.getCategories()).extracting(CategorySummary::getName).containsExactly("Pizza");
        assertThat(results.get(1).getRating()).isNull();
        assertThat(results.get(1).getRatingCount()).isZero();
    }

    @Test
    void shouldKeepOnlyBusinessesWithLocationInsideRadius() {
        when(catalogReader.findBusinesses(any())).thenReturn(List.of(
            CatalogBusinessRecord.builder()
                .id("near")
                .name("Near")
                .locations(List.of(location("far-branch", 40.80, -74.0060), location("close-branch", 40.7138, -74.0060)))
                .build(),
            CatalogBusinessRecord.builder()
                .id("far")
                .name("Far")
                .locations(List.of(location("far-only", 40.80, -74.0060)))
                .build(),
            CatalogBusinessRecord.builder()
                .id("unknown")
                .name("Unknown")
                .locations(List.of(BusinessLocation.builder().id("no-coordinates").build()))
                .build()));

        List<BusinessResult> results = localCatalogSearch.search(SearchQuery.builder()
            .query("place")
            .latitude(40.7128)
            .longitude(-74.0060)
            .radiusMeters(1000)
            .build());

        assertThat(results).extracting(BusinessResult::getId).containsExactly("near");
        assertThat(results.get(0).getDistanceMeters()).isBetween(110D, 112D);
    }

    @Test
    void shouldWrapReaderFailure() {
        DataAccessResourceFailureException failure = new DataAccessResourceFailureException("connection refused");
        when(catalogReader.findBusinesses(any())).thenThrow(failure);

        assertThatThrownBy(() -> localCatalogSearch.search(SearchQuery.builder().query("pizza").build()))
            .isInstanceOf(StorageUnavailableException.class)
            .hasCause(failure)
            .satisfies(ex -> assertThat(((StorageUnavailableException) ex).isRetryable()).isTrue());
    }

    @Test
    void shouldRethrowStorageUnavailableAsIs() {
        StorageUnavailableException failure = new StorageUnavailableException("down", new RuntimeException());
        when(catalogReader.findBusinesses(any())).thenThrow(failure);

        assertThatThrownBy(() -> localCatalogSearch.search(SearchQuery.builder().query("pizza").build()))
            .isSameAs(failure);
    }

    @Test
    void shouldAverageRating() {
        assertThat(LocalCatalogSearch.averageRating(9, 2)).isEqualTo(4.5);
        assertThat(LocalCatalogSearch.averageRating(14, 3)).isEqualTo(4.7);
        assertThat(LocalCatalogSearch.averageRating(0, 0)).isNull();
    }

    private static BusinessLocation location(String id, double latitude, double longitude) {
        return BusinessLocation.builder()
            .id(id)
            .address("1 Main St")
            .latitude(latitude)
            .longitude(longitude)
            .build();
    }

}
