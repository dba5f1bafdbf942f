package io.segmentlite.segment.compiler;

import io.segmentlite.engine.plan.ComparisonExpression;
import io.segmentlite.engine.plan.JoinNode;
import io.segmentlite.engine.plan.RelationNode;
import io.segmentlite.engine.plan.TableNode;
import io.segmentlite.engine.store.EventSchema;
import io.segmentlite.engine.store.EventTable;

import java.util.Set;

/**
 * Builds the FROM side of a query level: the event table, left-joined to the
 * session and user rollups it needs.
 */
final class EventJoins {

    private EventJoins() {
    }

    static RelationNode from(EventSchema schema, TableAliases aliases, Set<EventTable> requiredTables) {
        TableNode hits = new TableNode(schema.hits(), aliases.alias(EventTable.HITS));
        RelationNode from = hits;
        for (EventTable rollup : new EventTable[] {EventTable.SESSIONS, EventTable.USERS}) {
            if (requiredTables.contains(rollup)) {
                TableNode right = new TableNode(schema.table(rollup), aliases.alias(rollup));
                from = JoinNode.leftOuter(from, right, ComparisonExpression.equals(
                        hits.column(rollup.keyColumn()),
                        right.column(rollup.keyColumn())));
            }
        }
        return from;
    }
}
