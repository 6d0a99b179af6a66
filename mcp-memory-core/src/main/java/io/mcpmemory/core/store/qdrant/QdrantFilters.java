package io.mcpmemory.core.store.qdrant;

import io.mcpmemory.core.store.ListOptions;
import io.mcpmemory.core.store.SearchOptions;
import io.qdrant.client.grpc.Points.Filter;
import io.qdrant.client.grpc.Points.Range;
import java.util.List;

import static io.qdrant.client.ConditionFactory.matchKeyword;
import static io.qdrant.client.ConditionFactory.range;

/**
 * Server-side equivalents of {@link io.mcpmemory.core.store.NoteFilters}. All conditions
 * are conjunctive; a keyword match on the {@code tags} array holds when any element equals
 * the keyword, so one condition per required tag gives AND semantics.
 */
final class QdrantFilters {

    private QdrantFilters() {
    }

    static Filter forSearch(SearchOptions options) {
        Filter.Builder filter = scope(options.projectId(), options.groupId(), options.tags());
        if (options.hasTimeRange()) {
            Range.Builder window = Range.newBuilder();
            if (options.since() != null) {
                window.setGte(PayloadCodec.epochSeconds(options.since()));
            }
            if (options.until() != null) {
                window.setLt(PayloadCodec.epochSeconds(options.until()));
            }
            filter.addMust(range(PayloadCodec.CREATED_AT_TIMESTAMP, window.build()));
        }
        return filter.build();
    }

    static Filter forList(ListOptions options) {
        return scope(options.projectId(), options.groupId(), options.tags()).build();
    }

    static Filter forProject(String projectId) {
        return Filter.newBuilder()
            .addMust(matchKeyword(PayloadCodec.PROJECT_ID, projectId))
            .build();
    }

    static Filter forGroupKey(String projectId, String groupKey) {
        return Filter.newBuilder()
            .addMust(matchKeyword(PayloadCodec.PROJECT_ID, projectId))
            .addMust(matchKeyword(PayloadCodec.GROUP_KEY, groupKey))
            .build();
    }

    private static Filter.Builder scope(String projectId, String groupId, List<String> tags) {
        Filter.Builder filter = Filter.newBuilder()
            .addMust(matchKeyword(PayloadCodec.PROJECT_ID, projectId));
        if (groupId != null) {
            filter.addMust(matchKeyword(PayloadCodec.GROUP_ID, groupId));
        }
        for (String tag : tags) {
            filter.addMust(matchKeyword(PayloadCodec.TAGS, tag));
        }
        return filter;
    }
}
