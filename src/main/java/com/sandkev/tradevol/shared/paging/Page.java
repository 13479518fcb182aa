package com.sandkev.tradevol.shared.paging;

import org.springframework.lang.Nullable;

import java.util.List;

/** One upstream page; a null {@code next} cursor means there is nothing more to fetch. */
public record Page<T, C>(List<T> items, @Nullable C next) {

    public static <T, C> Page<T, C> last(List<T> items) {
        return new Page<>(items, null);
    }
}
