package com.example.chat.messaging.store;

import java.util.List;

public record PageResult<T>(List<T> items, int page, int limit, long total) {

    public boolean hasMore() {
        return (long) page * limit < total;
    }
}
