package com.sandkev.tradevol.domain;

import java.util.List;

/** Summary of one platform's historical backfill run. */
public record BackfillResult(
        Platform platform,
        Status status,
        int fetched,
        int stored,
        List<String> errors
) {

    public enum Status { SUCCESS, PARTIAL_SUCCESS, ERROR }

    public static BackfillResult error(Platform platform, String message) {
        return new BackfillResult(platform, Status.ERROR, 0, 0, List.of(message));
    }

    public static BackfillResult of(Platform platform, int fetched, int stored, List<String> errors) {
        Status status;
        if (errors.isEmpty()) status = Status.SUCCESS;
        else if (fetched > 0) status = Status.PARTIAL_SUCCESS;
        else status = Status.ERROR;
        return new BackfillResult(platform, status, fetched, stored, List.copyOf(errors));
    }
}
