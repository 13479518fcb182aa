package com.sandkev.tradevol.price;

/** What {@link PriceNormalizer} does when neither a fresh nor a last-known price exists. */
public enum PriceFallbackPolicy {
    /** Log the degradation and treat the asset as worth 1 USD. */
    DEFAULT_TO_ONE,
    /** Throw {@link PriceUnavailableException}; the caller reports the figure as an error. */
    FAIL_FAST
}
