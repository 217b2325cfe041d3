package org.gtfslake.gtfs_rt.generator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import org.gtfslake.gtfs_rt.exceptions.FeedSchemaException;

import com.google.protobuf.UninitializedMessageException;
import com.google.transit.realtime.GtfsRealtime;

/**
 * Helpers shared by the feed generators.
 *
 * @since 1.0
 */
final class FeedEntities {

    private FeedEntities() {
    }

    /**
     * Groups child rows by their parent key, keeping the child row-set order within each group.
     * Rows with a {@code null} key can never match a parent and are left out.
     */
    static <T> Map<String, List<T>> groupByParent(List<T> children, Function<T, String> parentKey) {
        Map<String, List<T>> groups = new LinkedHashMap<>();
        for (T child : children) {
            String key = parentKey.apply(child);
            if (key != null) {
                groups.computeIfAbsent(key, k -> new ArrayList<>()).add(child);
            }
        }
        return groups;
    }

    static <T> List<T> childrenOf(Map<String, List<T>> groups, String parentId) {
        if (parentId == null) {
            return Collections.emptyList();
        }
        return groups.getOrDefault(parentId, Collections.emptyList());
    }

    /**
     * Builds a feed entity, turning missing required fields into a {@link FeedSchemaException}.
     */
    static GtfsRealtime.FeedEntity build(GtfsRealtime.FeedEntity.Builder entity) {
        try {
            return entity.build();
        } catch (UninitializedMessageException e) {
            throw new FeedSchemaException(
                "Feed entity '" + entity.getId() + "' is missing required fields " + e.getMissingFields(), e);
        }
    }
}
