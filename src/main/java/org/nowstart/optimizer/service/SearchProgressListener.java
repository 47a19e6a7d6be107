package org.nowstart.optimizer.service;

import org.nowstart.optimizer.data.dto.SearchProgress;

@FunctionalInterface
public interface SearchProgressListener {

    SearchProgressListener NONE = progress -> {
    };

    void onProgress(SearchProgress progress);
}
