package org.kpa.tap.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.kpa.tap.configuration.KpaProperties;
import org.kpa.tap.models.entity.StreamBookmark;
import org.kpa.tap.repository.StreamBookmarkRepository;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class BookmarkService {

    private final StreamBookmarkRepository bookmarkRepository;
    private final KpaProperties properties;

    public Optional<Instant> currentBookmark(String streamName) {
        return bookmarkRepository.findByStreamName(streamName)
                .map(StreamBookmark::getReplicationValue);
    }

    // stored bookmark, else configured start date, else none
    public Instant startingBound(String streamName) {
        return currentBookmark(streamName)
                .or(properties::startInstant)
                .orElse(null);
    }

    public StreamBookmark advance(String streamName, String formId, String replicationKey, Instant value) {
        StreamBookmark bookmark = bookmarkRepository.findByStreamName(streamName).orElseGet(() -> {
            StreamBookmark created = new StreamBookmark();
            created.setStreamName(streamName);
            created.setFormId(formId);
            created.setReplicationKey(replicationKey);
            return created;
        });
        Instant current = bookmark.getReplicationValue();
        if (current != null && !value.isAfter(current)) {
            return bookmark;
        }
        bookmark.setReplicationValue(value);
        bookmark.setUpdatedAt(Instant.now());
        log.info("Advancing bookmark of {} from {} to {}", streamName, current, value);
        return bookmarkRepository.save(bookmark);
    }
}
