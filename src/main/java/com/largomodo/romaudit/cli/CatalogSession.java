package com.largomodo.romaudit.cli;

import com.largomodo.romaudit.catalog.CatalogStore;
import com.largomodo.romaudit.core.ChecksumIndex;
import com.largomodo.romaudit.core.QueryEngine;
import com.largomodo.romaudit.core.ResolutionEngine;

/**
 * A loaded catalog with the read-only engines built on top of it.
 */
record CatalogSession(CatalogStore store, ChecksumIndex index, ResolutionEngine resolution, QueryEngine queries) {

    static CatalogSession of(CatalogStore store) {
        ChecksumIndex index = ChecksumIndex.build(store);
        ResolutionEngine resolution = new ResolutionEngine(store);
        return new CatalogSession(store, index, resolution, new QueryEngine(store, index, resolution));
    }
}
