package com.tyron.padj.api.session;

import java.util.List;

/**
 * Ordered list of open tabs and the index of the active one.
 */
public record SessionData(List<TabEntry> tabs, int activeTabIndex) {

    public SessionData {
        if (activeTabIndex < 0) {
            throw new IllegalArgumentException("activeTabIndex=" + activeTabIndex + " must be >= 0");
        }
        tabs = List.copyOf(tabs);
    }
}
