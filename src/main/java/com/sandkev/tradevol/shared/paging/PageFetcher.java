package com.sandkev.tradevol.shared.paging;

@FunctionalInterface
public interface PageFetcher<T, C> {
    Page<T, C> fetch(C cursor);
}
