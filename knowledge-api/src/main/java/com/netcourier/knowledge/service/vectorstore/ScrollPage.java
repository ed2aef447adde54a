package com.netcourier.knowledge.service.vectorstore;

import java.util.List;

/**
 * @param nextOffset opaque continuation cursor, null on the last page
 */
public record ScrollPage(List<PointRecord> points, Object nextOffset) {

    public boolean hasNext() {
        return nextOffset != null;
    }
}
