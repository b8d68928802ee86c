package fun.fengwk.discovery.core.service.search.dedup;

import fun.fengwk.discovery.core.configuration.DiscoveryProperties;
import fun.fengwk.discovery.core.facade.search.model.BusinessLocation;
import fun.fengwk.discovery.core.facade.search.model.BusinessResult;
import fun.fengwk.discovery.core.facade.search.model.BusinessSource;
import fun.fengwk.discovery.core.geo.GeoMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.ListIterator;
import java.util.Set;

/**
 * Collapses external places into the catalog records that describe the same business.
 *
 * <p>Matching is greedy in input order: each catalog record absorbs at most the first unconsumed
 * external place whose name is similar and whose closest location is near enough. The catalog record
 * always wins, it keeps its name, rating and categories and only gains the external fields.
 * Already merged records are left as they are, so running the result through again changes nothing.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class Deduplicator {

    private final DiscoveryProperties properties;

    public DeduplicationResult deduplicate(List<BusinessResult> localResults, List<BusinessResult> externalResults) {
        List<BusinessResult> locals = distinctById(localResults);
        List<BusinessResult> externals = distinctById(externalResults);

        Set<String> localIds = new HashSet<>();
        for (BusinessResult local : locals) {
            localIds.add(local.getId());
        }
        LinkedList<BusinessResult> candidates = new LinkedList<>();
        for (BusinessResult external : externals) {
            if (localIds.contains(external.getId())) {
                log.debug("external id collides with catalog id, dropped, id={}", external.getId());
                continue;
            }
            candidates.add(external);
        }

        List<BusinessResult> results = new ArrayList<>(locals.size() + candidates.size());
        int merged = 0;
        for (BusinessResult local : locals) {
            if (local.getSource() == BusinessSource.MERGED) {
                results.add(local);
                continue;
            }
            BusinessResult match = takeFirstMatch(local, candidates);
            if (match == null) {
                results.add(local);
                continue;
            }
            merged++;
            log.debug("merged external place into catalog record, localId={}, externalId={}", local.getId(), match.getId());
            results.add(merge(local, match));
        }
        results.addAll(candidates);
        return new DeduplicationResult(results, locals.size(), externals.size(), merged);
    }

    private BusinessResult takeFirstMatch(BusinessResult local, List<BusinessResult> candidates) {
        ListIterator<BusinessResult> iterator = candidates.listIterator();
        while (iterator.hasNext()) {
            BusinessResult external = iterator.next();
            if (external.getSource() == BusinessSource.MERGED) {
                continue;
            }
            if (isSameBusiness(local, external)) {
                iterator.remove();
                return external;
            }
        }
        return null;
    }

    boolean isSameBusiness(BusinessResult local, BusinessResult external) {
        if (NameSimilarity.similarity(local.getName(), external.getName()) < properties.getNameSimilarityThreshold()) {
            return false;
        }
        Double closest = closestDistance(local.getLocations(), external.getLocations());
        return closest != null && closest <= properties.getMatchDistanceMeters();
    }

    /**
     * Smallest distance over all location pairs, null when either side has no coordinates.
     */
    static Double closestDistance(List<BusinessLocation> left, List<BusinessLocation> right) {
        if (left == null || right == null) {
            return null;
        }
        Double closest = null;
        for (BusinessLocation a : left) {
            if (a == null || !a.hasCoordinates()) {
                continue;
            }
            for (BusinessLocation b : right) {
                if (b == null || !b.hasCoordinates()) {
                    continue;
                }
                double distance = GeoMath.distanceMeters(a.getLatitude(), a.getLongitude(), b.getLatitude(), b.getLongitude());
                if (closest == null || distance < closest) {
                    closest = distance;
                }
            }
        }
        return closest;
    }

    private static BusinessResult merge(BusinessResult local, BusinessResult external) {
        String photoUrl = external.getExternalPhotoUrl() != null ? external.getExternalPhotoUrl() : external.getLogoUrl();
        return local.toBuilder()
            .source(BusinessSource.MERGED)
            .categories(new ArrayList<>(local.getCategories()))
            .locations(new ArrayList<>(local.getLocations()))
            .externalPlaceId(external.getExternalPlaceId())
            .externalRating(external.getRating())
            .externalRatingCount(external.getRatingCount())
            .externalPhotoUrl(photoUrl)
            .build();
    }

    private static List<BusinessResult> distinctById(List<BusinessResult> results) {
        List<BusinessResult> distinct = new ArrayList<>();
        if (results == null) {
            return distinct;
        }
        Set<String> seen = new HashSet<>();
        for (BusinessResult result : results) {
            if (result != null && seen.add(result.getId())) {
                distinct.add(result);
            }
        }
        return distinct;
    }

}
