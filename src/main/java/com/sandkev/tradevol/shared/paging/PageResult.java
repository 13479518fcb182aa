package com.sandkev.tradevol.shared.paging;

import com.sandkev.tradevol.shared.error.ExchangeException;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Accumulated items plus the error that ended paging early, if any. Items gathered before
 * an abort are kept.
 */
public record PageResult<T>(List<T> items, int pages, @Nullable ExchangeException error, boolean truncated) {

    public boolean isComplete() {
        return error == null && !truncated;
    }
}
