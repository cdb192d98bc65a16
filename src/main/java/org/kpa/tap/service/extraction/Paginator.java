package org.kpa.tap.service.extraction;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.kpa.tap.client.KpaRequestExecutor;
import org.kpa.tap.models.dto.ListRequest;
import org.kpa.tap.models.dto.ResponsePage;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

@Slf4j
@Component
@RequiredArgsConstructor
public class Paginator {

    private final KpaRequestExecutor requestExecutor;

    // a null startToken requests the first page without a page number
    public Stream<ResponsePage> paginate(ListRequest request, Integer startToken) {
        Iterator<ResponsePage> pages = new PageIterator(request, startToken);
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(pages, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    Integer nextPageToken(Map<String, Object> payload, Integer previousToken) {
        int previous = previousToken == null ? 1 : previousToken;
        int next = previous + 1;
        Object paging = payload.get("paging");
        int lastPage = 0;
        if (paging instanceof Map<?, ?> pagingMap && pagingMap.get("last_page") instanceof Number number) {
            lastPage = number.intValue();
        }
        log.info("Got paging response={}, prev_page={}, next_page={}", paging, previous, next);
        return lastPage >= next ? next : null;
    }

    private final class PageIterator implements Iterator<ResponsePage> {

        private final ListRequest request;
        private Integer token;
        private boolean finished;

        private PageIterator(ListRequest request, Integer startToken) {
            this.request = request;
            this.token = startToken;
        }

        @Override
        public boolean hasNext() {
            return !finished;
        }

        @Override
        public ResponsePage next() {
            if (finished) {
                throw new NoSuchElementException("No more pages for " + request.path());
            }
            Map<String, Object> body = new LinkedHashMap<>(request.body());
            if (token != null) {
                body.put("page", token);
            }
            log.info("Querying {} with params={}", request.path(), body);
            Map<String, Object> payload = requestExecutor.post(request.path(), body);

            int page = token == null ? 1 : token;
            Integer nextToken = request.paginated() ? nextPageToken(payload, token) : null;
            token = nextToken;
            finished = nextToken == null;
            return new ResponsePage(payload, page, nextToken);
        }
    }
}
