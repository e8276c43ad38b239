package ai.pipestream.s3manager.s3;

import java.util.List;

/**
 * One page of a paginated object listing.
 *
 * @param objects           objects on this page, in key order
 * @param continuationToken token for the next page, or {@code null} when this is the last page
 */
public record ObjectPage(List<ObjectSummary> objects, String continuationToken) {

    public ObjectPage {
        objects = List.copyOf(objects);
    }

    public boolean hasMore() {
        return continuationToken != null;
    }
}
