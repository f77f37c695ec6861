package com.strata.query;

import com.strata.domain.QueryInput;
import com.strata.domain.SortDirection;
import com.strata.domain.TableConfig;

/**
 * Forward and backward ORDER BY clauses for a listing. Both break ties on
 * UUID in the primary direction so cursor positions are totally ordered.
 */
public class SortOrders {
    private final String forward;
    private final String backward;

    private SortOrders(String forward, String backward) {
        this.forward = forward;
        this.backward = backward;
    }

    /**
     * Registers attribute sort keys as arguments of {@code sb}, so the clauses
     * are only valid in that builder.
     */
    public static SortOrders of(SelectBuilder sb, SortDirection paginationDirection, TableConfig config,
                                QueryInput params) {
        String sortColumn = "timestamp";
        SortDirection sortDirection = SortDirection.DESC;
        if (params.getSort() != null) {
            sortColumn = params.getSort().getColumn();
            sortDirection = params.getSort().getDirection();
        }

        String column = AttributeResolver.column(config, sortColumn);
        if (column == null) {
            column = AttributeResolver.attribute(sb, config, sortColumn, "");
        }

        String forwardDirection = "DESC";
        String backwardDirection = "ASC";
        if (paginationDirection == SortDirection.ASC || sortDirection == SortDirection.ASC) {
            forwardDirection = "ASC";
            backwardDirection = "DESC";
        }

        return new SortOrders(
            String.format("%s %s, UUID %s", column, forwardDirection, forwardDirection),
            String.format("%s %s, UUID %s", column, backwardDirection, backwardDirection));
    }

    public String getForward() {
        return forward;
    }

    public String getBackward() {
        return backward;
    }
}
