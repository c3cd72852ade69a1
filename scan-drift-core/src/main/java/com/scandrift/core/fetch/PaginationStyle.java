package com.scandrift.core.fetch;

/**
 * How a collection resource signals that another page exists.
 */
public enum PaginationStyle {
    /** Cursor link in the body at {@code /links/next}. */
    NEXT_LINK,
    /** Page counter in the {@code X-Next-Page} response header. */
    PAGE_HEADER,
    /** Single response. */
    NONE
}
